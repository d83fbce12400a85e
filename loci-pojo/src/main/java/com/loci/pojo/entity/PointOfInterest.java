package com.loci.pojo.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 规范化 POI，(name, city_id) 唯一；坐标存于 PostGIS location 列。
 */
@Data
@TableName("points_of_interest")
public class PointOfInterest {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String name;

    private Long cityId;

    private String category;

    private String description;

    /** 由 ST_Y(location) 读出 */
    @TableField(exist = false)
    private Double latitude;

    /** 由 ST_X(location) 读出 */
    @TableField(exist = false)
    private Double longitude;

    /** 距离查询结果（米） */
    @TableField(exist = false)
    private Double distance;

    private LocalDateTime createdAt;
}
