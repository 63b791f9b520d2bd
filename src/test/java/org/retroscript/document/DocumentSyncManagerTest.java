package org.retroscript.document;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.retroscript.compiler.ir.ActionIR;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DocumentSyncManagerTest {

    /**
     * Clock that only moves when told to.
     */
    private static final class ManualClock extends Clock {

        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private ScriptDocument document;
    private ManualClock clock;
    private DocumentSyncManager manager;

    @BeforeEach
    void setUp() {
        document = new ScriptDocument(new DocumentOptions(false, Duration.ofMillis(500), "main", "F5", "F6", "F7"));
        clock = new ManualClock();
        manager = new DocumentSyncManager(document, Duration.ofMillis(500), clock);
    }

    @Test
    void codeIsSyncedAfterQuietPeriod() {
        manager.onCodeChanged("flow main { click(1, 2); }");

        assertThat(manager.poll()).isFalse();
        clock.advance(Duration.ofMillis(499));
        assertThat(manager.poll()).isFalse();
        clock.advance(Duration.ofMillis(1));

        assertThat(manager.poll()).isTrue();
        assertThat(manager.hasPending()).isFalse();
        assertThat(manager.getFlowNames()).containsExactly("main");
    }

    @Test
    void newEditRestartsQuietPeriod() {
        manager.onCodeChanged("flow a { }");
        clock.advance(Duration.ofMillis(400));
        manager.onCodeChanged("flow b { }");
        clock.advance(Duration.ofMillis(400));

        assertThat(manager.poll()).isFalse();
        clock.advance(Duration.ofMillis(100));
        assertThat(manager.poll()).isTrue();
        assertThat(manager.getFlowNames()).containsExactly("b");
    }

    @Test
    void flushNowSyncsImmediatelyAndDropsPending() {
        manager.onCodeChanged("flow stale { }");

        manager.flushNow("flow saved { }");
        clock.advance(Duration.ofSeconds(1));

        assertThat(manager.poll()).isFalse();
        assertThat(manager.getFlowNames()).containsExactly("saved");
    }

    @Test
    void cancelPendingDiscardsEdit() {
        manager.onCodeChanged("flow main { }");
        manager.cancelPending();
        clock.advance(Duration.ofSeconds(1));

        assertThat(manager.poll()).isFalse();
        assertThat(manager.getFlowNames()).isEmpty();
    }

    @Test
    void guiEditsAreAppliedToDocument() {
        manager.flushNow("flow main { click(1, 2); }");
        ActionIR sleep = new ActionIR("sleep");
        sleep.setParam("arg0", 1L);

        assertThat(manager.onActionAdded("main", sleep, 0)).isTrue();
        assertThat(manager.onActionsReordered("main", 0, 1)).isTrue();
        assertThat(manager.onActionChanged("main", 0, new ActionIR(ActionIR.BREAK))).isTrue();
        assertThat(manager.onActionRemoved("main", 1)).isTrue();

        assertThat(document.getCode()).isEqualTo("flow main {\n  break;\n}\n");
    }

    @Test
    void codeChangesDuringSyncAreIgnored() {
        document.addListener(new DocumentListener() {
            @Override
            public void onIrChanged(String changeType) {
                manager.onCodeChanged("flow reentrant { }");
            }
        });

        manager.flushNow("flow main { }");

        assertThat(manager.hasPending()).isFalse();
    }
}
