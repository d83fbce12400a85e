package com.loci.pojo.dto;

import lombok.Data;

import java.util.List;

/**
 * 城市三件套（城市概况 + 通用 POI + 个性化行程）生成请求。
 */
@Data
public class CityBundleRequestDTO {

    /**
     * 城市名称（必填）。
     */
    private String cityName;

    /**
     * 当前用户，由服务端从请求上下文填充。
     */
    private Long userId;

    /**
     * 用户偏好画像 ID（可选）。
     */
    private Long profileId;

    /**
     * 会话 ID（可选），写入交互记录。
     */
    private String sessionId;

    /**
     * 兴趣名称，例如 museums、street food。
     */
    private List<String> interests;

    /**
     * 个性化标签。
     */
    private List<String> tags;

    /**
     * 其它自由文本偏好（可选）。
     */
    private String preferences;

    /**
     * 用户当前位置（可选），用于距离排序。
     */
    private Double userLatitude;

    private Double userLongitude;

    /**
     * 是否把结果落库，默认 true。
     */
    private Boolean persist = Boolean.TRUE;
}
