package com.precojusto.cronbatch.pipeline;

import com.precojusto.cronbatch.domain.WorkItem;
import lombok.Getter;

/**
 * Inputs of the finalize capability: every step output plus the item payload.
 */
public class FinalizeContext {

    @Getter
    private final WorkItem item;

    @Getter
    private final StepOutputs outputs;

    private final CheckpointCodec codec;

    public FinalizeContext(WorkItem item, StepOutputs outputs, CheckpointCodec codec) {
        this.item = item;
        this.outputs = outputs;
        this.codec = codec;
    }

    public <T> T payload(Class<T> type) {
        return codec.decode(item.getPayloadJson(), type, "payload of work item " + item.getId());
    }

    public <T> T output(String step, Class<T> type) {
        return outputs.get(step, type);
    }

    /**
     * Stable key for the side effects of this item. Finalization may be attempted
     * more than once, so collaborators use it to drop repeated effects.
     */
    public String getIdempotencyKey() {
        return "work-item-" + item.getId();
    }
}
