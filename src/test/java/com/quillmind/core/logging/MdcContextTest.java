package com.quillmind.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setBatch puts batchId in MDC")
    void setBatch() {
        MdcContext.setBatch("QV-1234abcd");
        assertEquals("QV-1234abcd", MDC.get("batchId"));
    }

    @Test
    @DisplayName("setConflict puts batchId and conflictId in MDC")
    void setConflict() {
        MdcContext.setConflict("CR-1", "c-7");
        assertEquals("CR-1", MDC.get("batchId"));
        assertEquals("c-7", MDC.get("conflictId"));
    }

    @Test
    @DisplayName("clearElement keeps the batch")
    void clearElement() {
        MdcContext.setModule("QV-1", "emotionArc");
        assertEquals("emotionArc", MDC.get("moduleName"));
        MdcContext.clearElement();
        assertEquals("QV-1", MDC.get("batchId"));
        assertNull(MDC.get("moduleName"));
    }

    @Test
    @DisplayName("clear removes all quillmind MDC keys")
    void clear() {
        MdcContext.setConflict("CR-1", "c-7");
        MdcContext.setModule("CR-1", "plotStructure");
        MdcContext.clear();
        assertNull(MDC.get("batchId"));
        assertNull(MDC.get("conflictId"));
        assertNull(MDC.get("moduleName"));
    }
}
