package com.meetbridge.model.message;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class MemoryUsageMessage extends ControlMessage {

    private MemoryUsage memoryUsage;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MemoryUsage {
        private long heapSizeLimit;
        private long totalHeapSize;
        private long usedHeapSize;
    }

    @Override
    public ControlMessageType getType() {
        return ControlMessageType.MEMORY_USAGE;
    }
}
