package com.loci.server.task;

import com.loci.server.service.ChatSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时把超过 expires_at 的活跃会话标记为 expired。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatSessionExpiryTask {

    private final ChatSessionService chatSessionService;

    @Scheduled(fixedDelayString = "${loci.chat.session-expiry-interval-ms:300000}")
    public void expireStaleSessions() {
        try {
            int expired = chatSessionService.expireStaleSessions();
            if (expired > 0) {
                log.info("过期会话清理完成: expired={}", expired);
            }
        } catch (DataAccessException e) {
            log.warn("过期会话清理失败，下轮重试: {}", e.getMessage());
        }
    }
}
