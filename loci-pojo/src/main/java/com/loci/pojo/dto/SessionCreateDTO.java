package com.loci.pojo.dto;

import lombok.Data;

@Data
public class SessionCreateDTO {

    private Long profileId;

    private String cityName;
}
