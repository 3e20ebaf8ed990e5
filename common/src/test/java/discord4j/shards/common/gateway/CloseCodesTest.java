package discord4j.shards.common.gateway;

import org.junit.Test;

import static org.junit.Assert.*;

public class CloseCodesTest {

    @Test
    public void normalClosesRequireNewSession() {
        assertEquals(DisconnectBehavior.REIDENTIFY, CloseCodes.behaviorFor(1000));
        assertEquals(DisconnectBehavior.REIDENTIFY, CloseCodes.behaviorFor(1001));
        assertEquals(DisconnectBehavior.REIDENTIFY, CloseCodes.behaviorFor(CloseCodes.INVALID_SEQ));
        assertEquals(DisconnectBehavior.REIDENTIFY, CloseCodes.behaviorFor(CloseCodes.SESSION_TIMED_OUT));
    }

    @Test
    public void configurationErrorsStop() {
        int[] fatal = {CloseCodes.AUTHENTICATION_FAILED, CloseCodes.INVALID_SHARD, CloseCodes.SHARDING_REQUIRED,
                CloseCodes.INVALID_API_VERSION, CloseCodes.INVALID_INTENTS, CloseCodes.DISALLOWED_INTENTS};
        for (int code : fatal) {
            assertEquals("code " + code, DisconnectBehavior.STOP, CloseCodes.behaviorFor(code));
            assertTrue(CloseCodes.isFatal(code));
        }
    }

    @Test
    public void otherCodesResume() {
        int[] resumable = {1006, CloseCodes.UNKNOWN_ERROR, CloseCodes.UNKNOWN_OPCODE, CloseCodes.DECODE_ERROR,
                CloseCodes.NOT_AUTHENTICATED, CloseCodes.ALREADY_AUTHENTICATED, CloseCodes.RATE_LIMITED,
                CloseCodes.RESUMABLE_CLOSE, 4999};
        for (int code : resumable) {
            assertEquals("code " + code, DisconnectBehavior.RESUME, CloseCodes.behaviorFor(code));
            assertFalse(CloseCodes.isFatal(code));
        }
    }
}
