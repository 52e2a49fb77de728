package com.csd.updateserver.service;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class VersionUtilTest {

    @Test
    void compareVersions() {
        assertTrue(VersionUtil.compare("1.0.0", "1.0.1") < 0);
        assertTrue(VersionUtil.compare("2.0.0", "1.9.9") > 0);
        assertTrue(VersionUtil.compare("1.10.0", "1.9.0") > 0);
        assertEquals(0, VersionUtil.compare("1.0", "1.0"));
    }

    @Test
    void belowLogic() {
        assertTrue(VersionUtil.isBelow("1.0.0", "2.0.0"));
        assertFalse(VersionUtil.isBelow("2.0.0", "2.0.0"));
        assertFalse(VersionUtil.isBelow("2.1.0", "2.0.0"));
        assertFalse(VersionUtil.isBelow("garbage", "2.0.0"));
    }

    @Test
    void numericCheck() {
        assertTrue(VersionUtil.isNumeric("2.0.0"));
        assertTrue(VersionUtil.isNumeric(" 1.2 "));
        assertFalse(VersionUtil.isNumeric("2.0.0-beta"));
        assertFalse(VersionUtil.isNumeric(null));
    }
}
