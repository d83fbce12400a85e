package com.loci.pojo.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 会话上下文：最近一次识别出的领域与意图、偏好、修改记录。
 */
@Data
public class SessionContext {

    private String lastDomain;

    private String lastIntent;

    private String preferences;

    private List<String> modificationHistory = new ArrayList<>();
}
