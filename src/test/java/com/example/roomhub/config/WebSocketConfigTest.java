package com.example.roomhub.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WebSocketConfigTest {

    @Test
    void originsAreTrimmedAndTakenLiterally() {
        String[] patterns = WebSocketConfig.originPatterns(" http://localhost:5173, https://*.example.org ,");

        assertArrayEquals(new String[] {"http://localhost:5173", "https://*.example.org"}, patterns);
    }

    @Test
    void emptyListAllowsEverything() {
        assertArrayEquals(new String[] {"*"}, WebSocketConfig.originPatterns(" , "));
    }
}
