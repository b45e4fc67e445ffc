package io.procmacro.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.procmacro.core.error.ErrorKind;
import io.procmacro.core.model.CompileError;
import io.procmacro.core.model.CompileReport;
import io.procmacro.core.model.IdRange;
import io.procmacro.core.spi.CompileListener;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("CompileListener notifications")
class CompileListenerTest {

    private final List<CompileListener.CompileSucceededEvent> succeeded = new ArrayList<>();
    private final List<CompileListener.CompileFailedEvent> failed = new ArrayList<>();

    private final CompileListener recording = new CompileListener() {
        @Override
        public void onCompileSucceeded(CompileSucceededEvent event) {
            succeeded.add(event);
        }

        @Override
        public void onCompileFailed(CompileFailedEvent event) {
            failed.add(event);
        }
    };

    private ListAppender<ILoggingEvent> logAppender;
    private Logger compilerLogger;

    @BeforeEach
    void setUp() {
        compilerLogger = (Logger) LoggerFactory.getLogger(ProcedureCompiler.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        compilerLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        compilerLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Test
    @DisplayName("Success event carries the allocation audit and digest")
    void successEvent() {
        ProcedureCompiler compiler = new ProcedureCompiler(CompileLimits.DEFAULT, recording);

        CompileReport report = compiler.compile("p", List.of("@ALLOC A = 2", "@ALLOC B = 1", "{A} x", "{B} y"));

        assertThat(failed).isEmpty();
        assertThat(succeeded).singleElement().satisfies(event -> {
            assertThat(event.source()).isEqualTo("p");
            assertThat(event.steps()).isEqualTo(2);
            assertThat(event.allocations().keySet()).containsExactly("A", "B");
            assertThat(event.allocations().get("B")).isEqualTo(new IdRange(2, 1));
            assertThat(event.sha256()).isEqualTo(report.sha256());
        });
    }

    @Test
    @DisplayName("Failure event carries the ordered errors")
    void failureEvent() {
        ProcedureCompiler compiler = new ProcedureCompiler(CompileLimits.DEFAULT, recording);

        compiler.compile("p", List.of("{1} a", "{1} b", "check {9}"));

        assertThat(succeeded).isEmpty();
        assertThat(failed).singleElement().satisfies(event -> assertThat(event.errors())
                .extracting(CompileError::kind)
                .containsExactly(ErrorKind.DUPLICATE_MEASUREMENT_ID, ErrorKind.ORPHAN_EXPECTED_ID));
    }

    @Test
    @DisplayName("A throwing listener does not change the report")
    void throwingListener() {
        CompileListener broken = new CompileListener() {
            @Override
            public void onCompileSucceeded(CompileSucceededEvent event) {
                throw new IllegalStateException("boom");
            }

            @Override
            public void onCompileFailed(CompileFailedEvent event) {
                throw new IllegalStateException("boom");
            }
        };
        ProcedureCompiler compiler = new ProcedureCompiler(CompileLimits.DEFAULT, broken);

        assertThat(compiler.compile("ok", List.of("{0} x")).isSuccess()).isTrue();
        assertThat(compiler.compile("bad", List.of("{X} x")).isFailure()).isTrue();
        assertThat(logAppender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .contains("CompileListener.onCompileSucceeded failed", "CompileListener.onCompileFailed failed");
    }
}
