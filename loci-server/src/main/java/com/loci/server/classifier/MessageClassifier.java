package com.loci.server.classifier;

import com.loci.pojo.enums.ChatDomain;
import com.loci.pojo.enums.ChatIntent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 消息分类器：启动时构建一次自动机，之后只读，可被并发调用。
 */
@Component
@Slf4j
public class MessageClassifier {

    private final IntentClassifier intentClassifier;
    private final DomainDetector domainDetector;

    public MessageClassifier() {
        this.intentClassifier = new IntentClassifier();
        this.domainDetector = new DomainDetector();
        log.info("消息分类器初始化完成");
    }

    public Classification classify(String message) {
        ChatDomain domain = domainDetector.detect(message);
        ChatIntent intent = intentClassifier.classify(message);
        log.debug("消息分类: domain={}, intent={}", domain.getCode(), intent.getCode());
        return new Classification(domain, intent);
    }

    public ChatDomain detectDomain(String message) {
        return domainDetector.detect(message);
    }

    public ChatIntent classifyIntent(String message) {
        return intentClassifier.classify(message);
    }
}
