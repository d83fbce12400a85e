package com.loci.server.classifier;

import com.loci.pojo.enums.ChatDomain;
import com.loci.pojo.enums.ChatIntent;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class Classification {

    private final ChatDomain domain;

    private final ChatIntent intent;
}
