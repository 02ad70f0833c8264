package fr.lapetina.modelhost.domain.model;

/**
 * Point-in-time reading of one accelerator.
 *
 * @param id                 device index as reported by the management interface
 * @param name               device name
 * @param memoryTotalBytes   total device memory
 * @param memoryUsedBytes    device memory in use
 * @param utilizationPercent compute utilization, 0-100
 */
public record AcceleratorMetrics(
        int id,
        String name,
        long memoryTotalBytes,
        long memoryUsedBytes,
        double utilizationPercent
) {

    public long memoryFreeBytes() {
        return Math.max(0, memoryTotalBytes - memoryUsedBytes);
    }

    public double memoryPercent() {
        return memoryTotalBytes > 0 ? (memoryUsedBytes * 100.0) / memoryTotalBytes : 0.0;
    }
}
