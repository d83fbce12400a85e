package com.loci.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.loci.pojo.entity.ChatSession;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

/**
 * JSON 字段以文本传入，SQL 中显式转换为 jsonb。
 */
@Mapper
public interface ChatSessionMapper extends BaseMapper<ChatSession> {

    @Insert("INSERT INTO chat_sessions (id, user_id, profile_id, city_name, current_itinerary, "
            + "conversation_history, session_context, status, created_at, updated_at, expires_at) "
            + "VALUES (#{id}, #{userId}, #{profileId}, #{cityName}, CAST(#{currentItinerary} AS jsonb), "
            + "CAST(#{conversationHistory} AS jsonb), CAST(#{sessionContext} AS jsonb), #{status}, "
            + "#{createdAt}, #{updatedAt}, #{expiresAt})")
    int insertSession(ChatSession session);

    /**
     * 整体覆盖（last-writer-wins）。
     */
    @Update("UPDATE chat_sessions SET city_name = #{cityName}, "
            + "current_itinerary = CAST(#{currentItinerary} AS jsonb), "
            + "conversation_history = CAST(#{conversationHistory} AS jsonb), "
            + "session_context = CAST(#{sessionContext} AS jsonb), "
            + "status = #{status}, updated_at = #{updatedAt}, expires_at = #{expiresAt} "
            + "WHERE id = #{id}")
    int updateSession(ChatSession session);

    /**
     * 只更新城市、行程快照与上下文，conversation_history 保持不动。
     */
    @Update("UPDATE chat_sessions SET city_name = #{cityName}, "
            + "current_itinerary = CAST(#{currentItinerary} AS jsonb), "
            + "session_context = CAST(#{sessionContext} AS jsonb), "
            + "updated_at = NOW() WHERE id = #{id}")
    int updateSessionState(@Param("id") String id,
                           @Param("cityName") String cityName,
                           @Param("currentItinerary") String currentItinerary,
                           @Param("sessionContext") String sessionContext);

    /**
     * 原子追加一条消息到 conversation_history 末尾，避免读-改-写丢消息。
     */
    @Update("UPDATE chat_sessions SET conversation_history = "
            + "COALESCE(conversation_history, '[]'::jsonb) || jsonb_build_array(CAST(#{messageJson} AS jsonb)), "
            + "updated_at = NOW() WHERE id = #{id}")
    int appendMessage(@Param("id") String id, @Param("messageJson") String messageJson);

    @Update("UPDATE chat_sessions SET status = 'expired', updated_at = NOW() "
            + "WHERE status = 'active' AND expires_at < NOW()")
    int expireStaleSessions();
}
