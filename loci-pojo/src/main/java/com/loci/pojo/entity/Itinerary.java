package com.loci.pojo.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 用户在某城市的行程，(user_id, city_id) 唯一。
 */
@Data
@TableName("itineraries")
public class Itinerary {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long userId;

    private Long cityId;

    /** 最近一次刷新该行程的 LLM 交互 */
    private Long sourceLlmInteractionId;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
