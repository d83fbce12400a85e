package com.loci.pojo.enums;

public enum ChatIntent {

    ADD_POI("add_poi"),
    REMOVE_POI("remove_poi"),
    ASK_QUESTION("ask_question"),
    MODIFY_ITINERARY("modify_itinerary");

    private final String code;

    ChatIntent(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
