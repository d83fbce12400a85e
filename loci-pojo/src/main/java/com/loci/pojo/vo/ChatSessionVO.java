package com.loci.pojo.vo;

import com.loci.pojo.ai.ItineraryResponse;
import com.loci.pojo.dto.ConversationMessage;
import com.loci.pojo.dto.SessionContext;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
public class ChatSessionVO {

    private String id;

    private Long userId;

    private Long profileId;

    private String cityName;

    private ItineraryResponse currentItinerary;

    private List<ConversationMessage> conversationHistory = new ArrayList<>();

    private SessionContext sessionContext;

    private String status;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private LocalDateTime expiresAt;
}
