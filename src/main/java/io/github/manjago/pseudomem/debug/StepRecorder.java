package io.github.manjago.pseudomem.debug;

import io.github.manjago.pseudomem.core.Allocation;
import io.github.manjago.pseudomem.core.MemoryView;
import io.github.manjago.pseudomem.core.Value;
import io.github.manjago.pseudomem.exec.DebugSnapshot;
import io.github.manjago.pseudomem.exec.ExecutionListener;
import io.github.manjago.pseudomem.exec.StepHandler;
import io.github.manjago.pseudomem.trace.TraceEntry;
import io.github.manjago.pseudomem.trace.TraceLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Records a frame at every debug step and grants the step immediately.
 *
 * Usage:
 * <pre>
 * Evaluator evaluator = new Evaluator(config);
 * StepRecorder recorder = new StepRecorder(100, evaluator.getMemory(), evaluator.getTrace());
 * evaluator.setListener(recorder);
 * evaluator.executeProgram(program, ExecutionOptions.builder(config)
 *         .debugMode(true).stepHandler(recorder).build()).forEachRemaining(line -> {});
 * List&lt;StepFrame&gt; frames = recorder.getFrames();
 * </pre>
 */
public class StepRecorder implements StepHandler, ExecutionListener {

    private static final Logger log = LoggerFactory.getLogger(StepRecorder.class);

    private final List<StepFrame> frames = new ArrayList<>();
    private final int maxFrames;
    private final MemoryView memory;
    private final TraceLog trace;

    // Output produced since the last frame
    private final List<String> pendingOutput = new ArrayList<>();
    private int traceSeen = 0;

    public StepRecorder(int maxFrames, MemoryView memory, TraceLog trace) {
        this.maxFrames = maxFrames;
        this.memory = memory;
        this.trace = trace;
    }

    @Override
    public CompletionStage<Void> awaitStep(DebugSnapshot snapshot) {
        recordFrame(snapshot);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void onOutput(String line) {
        pendingOutput.add(line);
    }

    /**
     * Record a frame from the state before the next statement.
     */
    public void recordFrame(DebugSnapshot snapshot) {
        if (frames.size() >= maxFrames) {
            return;
        }

        StepFrame.Builder builder = new StepFrame.Builder(frames.size(), snapshot.currentLine())
                .callStack(snapshot.callStack());
        snapshot.variables().values().forEach(builder::addVariable);
        recordMemory(builder);
        recordEvents(builder);
        pendingOutput.forEach(builder::addOutput);
        pendingOutput.clear();

        frames.add(builder.build());

        if (frames.size() % 10 == 0) {
            log.debug("Recorded {} frames", frames.size());
        }
    }

    public boolean isComplete() {
        return frames.size() >= maxFrames;
    }

    public List<StepFrame> getFrames() {
        return Collections.unmodifiableList(frames);
    }

    public int getFrameCount() {
        return frames.size();
    }

    // ========== Private helpers ==========

    private void recordMemory(StepFrame.Builder builder) {
        for (Allocation allocation : memory.getAllocations()) {
            List<String> values = new ArrayList<>(allocation.size());
            for (int addr = allocation.address(); addr < allocation.end(); addr++) {
                Value value = memory.peek(addr);
                values.add(value != null ? value.display() : null);
            }
            builder.addBlock(new StepFrame.MemoryBlock(allocation.address(), allocation.type(), values));
        }
    }

    private void recordEvents(StepFrame.Builder builder) {
        List<TraceEntry> entries = trace.getTraceLog();
        for (int i = traceSeen; i < entries.size(); i++) {
            builder.addEvent(entries.get(i));
        }
        traceSeen = entries.size();
    }
}
