package com.loci.pojo.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("cities")
public class City {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String name;

    private String country;

    private String stateProvince;

    /** AI 生成的城市简介 */
    private String aiSummary;

    private Double centerLatitude;

    private Double centerLongitude;

    private LocalDateTime createdAt;
}
