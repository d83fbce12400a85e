package com.loci.pojo.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 单次生成给出的建议 POI，(name, latitude, longitude) 唯一。
 */
@Data
@TableName("llm_suggested_pois")
public class LlmSuggestedPoi {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long userId;

    private Long searchProfileId;

    private Long llmInteractionId;

    private Long cityId;

    private String name;

    private String descriptionPoi;

    private String category;

    private String address;

    private String website;

    private Double latitude;

    private Double longitude;

    /** 距离查询结果（米） */
    @TableField(exist = false)
    private Double distance;

    private LocalDateTime createdAt;
}
