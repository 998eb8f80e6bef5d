package com.faasrt.loader.fixtures;

import java.util.Map;

public class NotAHandler {

    public Object handle(Map<String, Object> payload) {
        return payload;
    }
}
