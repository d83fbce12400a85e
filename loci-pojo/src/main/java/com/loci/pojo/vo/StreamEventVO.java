package com.loci.pojo.vo;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 流式推送给前端的单个事件。
 */
@Data
public class StreamEventVO {

    public static final String TYPE_START = "start";
    public static final String TYPE_CLASSIFICATION = "classification";
    public static final String TYPE_CITY_DATA = "city_data";
    public static final String TYPE_CHUNK = "chunk";
    public static final String TYPE_PART_COMPLETE = "part_complete";
    public static final String TYPE_ERROR = "error";
    public static final String TYPE_COMPLETE = "complete";

    private String eventId;

    private String type;

    /** 事件来源的任务/领域，例如 city_data、general_pois、dining */
    private String part;

    private Object data;

    private String error;

    private boolean isFinal;

    private LocalDateTime timestamp;

    public static StreamEventVO of(String type, String part, Object data) {
        StreamEventVO e = new StreamEventVO();
        e.setEventId(UUID.randomUUID().toString());
        e.setType(type);
        e.setPart(part);
        e.setData(data);
        e.setTimestamp(LocalDateTime.now());
        e.setFinal(TYPE_COMPLETE.equals(type));
        return e;
    }

    public static StreamEventVO error(String part, String error) {
        StreamEventVO e = of(TYPE_ERROR, part, null);
        e.setError(error);
        return e;
    }
}
