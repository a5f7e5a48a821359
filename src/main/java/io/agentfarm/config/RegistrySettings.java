package io.agentfarm.config;

/**
 * Shape of the machine-wide port space: blocks of {@code blockSize} ports starting at
 * {@code floor}, at most {@code maxBlocks} of them.
 */
public record RegistrySettings(int floor, int blockSize, int maxBlocks) {
    public static final int DEFAULT_FLOOR = 4200;
    public static final int DEFAULT_BLOCK_SIZE = 100;
    public static final int DEFAULT_MAX_BLOCKS = 58;

    public RegistrySettings {
        if (floor <= 0 || floor > 65535) {
            throw new IllegalArgumentException("floor out of range: " + floor);
        }
        if (blockSize < 70) {
            throw new IllegalArgumentException("blockSize must cover all role offsets, got: " + blockSize);
        }
        if (maxBlocks <= 0) {
            throw new IllegalArgumentException("maxBlocks must be > 0, got: " + maxBlocks);
        }
        if ((long) floor + (long) maxBlocks * blockSize > 65536L) {
            throw new IllegalArgumentException("port space exceeds 65535");
        }
    }

    public static RegistrySettings defaults() {
        return new RegistrySettings(DEFAULT_FLOOR, DEFAULT_BLOCK_SIZE, DEFAULT_MAX_BLOCKS);
    }

    /**
     * First base port that may never be handed out.
     */
    public int ceiling() {
        return floor + maxBlocks * blockSize;
    }
}
