package airbrake;

import airbrake.util.JsonCodec;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NoticeTest {

    private final JsonCodec codec = JsonCodec.getDefault();

    @Test
    void capturesErrorAndCauseChainUpToThreeErrors() {
        Exception root = new IOException("disk");
        Exception mid = new IllegalStateException("state", root);
        Exception top = new RuntimeException("top", mid);
        Exception outer = new RuntimeException("outer", top);

        Notice notice = new Notice(outer);

        assertEquals(3, notice.errors().size());
        assertEquals("outer", notice.errors().get(0).message());
        assertEquals("java.lang.IllegalStateException", notice.errors().get(2).type());
    }

    @Test
    void selfReferencingCauseDoesNotLoop() {
        Exception a = new Exception("a");
        Exception b = new Exception("b", a);
        a.initCause(b);

        assertEquals(2, new Notice(a).errors().size());
    }

    @Test
    void explicitBacktraceReplacesTopLevelFramesOnly() {
        Exception cause = new IllegalArgumentException("cause");
        Exception error = new RuntimeException("boom", cause);
        List<StackFrame> frames = List.of(new StackFrame("Main.java", 3, "Main.main"));

        Notice notice = new Notice(error, frames);

        assertEquals(frames, notice.backtrace());
        assertEquals(cause.getStackTrace().length, notice.errors().get(1).backtrace().size());
    }

    @Test
    void defaultContextDescribesNotifier() {
        Notice notice = new Notice(new RuntimeException("x"));

        @SuppressWarnings("unchecked")
        Map<String, Object> notifier = (Map<String, Object>) notice.context().get("notifier");
        assertEquals(Notice.NOTIFIER_NAME, notifier.get("name"));
        assertEquals("error", notice.context().get("severity"));
        assertTrue(notice.context().get("language").toString().startsWith("java/"));
    }

    @Test
    void idsAreUnique() {
        assertNotEquals(new Notice(new RuntimeException()).id(), new Notice(new RuntimeException()).id());
    }

    @Test
    void ignoreIsSticky() {
        Notice notice = new Notice(new RuntimeException("x"));
        assertFalse(notice.isIgnored());
        notice.ignore();
        assertTrue(notice.isIgnored());
        assertTrue(notice.toString().contains("ignored"));
    }

    // ── Encoding ────────────────────────────────────────────────────

    @Test
    void toJsonRendersWireDocument() {
        Notice notice = new Notice(new RuntimeException("boom"));
        notice.params().put("user", "bob");

        Map<String, Object> parsed = codec.parseObject(notice.toJson(codec));

        assertTrue(parsed.keySet().containsAll(List.of("errors", "context", "environment", "session", "params")));
        assertEquals(Map.of("user", "bob"), parsed.get("params"));
    }

    @Test
    void oversizedPayloadIsTruncatedWithoutTouchingNotice() {
        Notice notice = new Notice(new RuntimeException("boom"));
        String big = "x".repeat(100_000);
        notice.params().put("blob", big);

        String json = notice.toJson(codec);

        assertNotNull(json);
        assertTrue(json.length() <= Notice.MAX_NOTICE_SIZE);
        assertTrue(json.contains("[Truncated]"));
        assertEquals(big, notice.params().get("blob"));
    }

    @Test
    void payloadThatCannotShrinkIsRefused() {
        Notice notice = new Notice(new RuntimeException("boom"));
        // keys are never cut, and the last attempt still keeps 78 of these 1 KB keys
        for (int i = 0; i < 100; i++) {
            notice.params().put(i + "k".repeat(1_000), 1);
        }

        assertNull(notice.toJson(codec));
    }
}
