package io.teamrelay.runtime;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class TeammateResultRelayTest {
    @Test
    void outputAtLimitIsKeptWhole() {
        String text = "a".repeat(TeammateResultRelay.MAX_RESULT_CHARS);
        Assertions.assertSame(text, TeammateResultRelay.truncate(text));
    }

    @Test
    void outputPastLimitIsCutAndMarked() {
        String text = "a".repeat(TeammateResultRelay.MAX_RESULT_CHARS) + "bcd";
        String truncated = TeammateResultRelay.truncate(text);
        Assertions.assertEquals("a".repeat(TeammateResultRelay.MAX_RESULT_CHARS) + "\n\n[truncated]", truncated);
    }
}
