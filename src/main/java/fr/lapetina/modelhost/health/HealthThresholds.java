package fr.lapetina.modelhost.health;

import fr.lapetina.modelhost.infrastructure.config.ServiceConfig;

/**
 * Limits used by the health checks. All comparisons are strictly greater-than.
 * Percentages are 0-100.
 */
public record HealthThresholds(
        double cpuWarningPercent,
        double cpuCriticalPercent,
        double memoryWarningPercent,
        double memoryCriticalPercent,
        double diskWarningPercent,
        double diskCriticalPercent,
        int processCountWarning,
        double temperatureWarningCelsius,
        double memoryPressurePercent,
        double diskPerformancePercent,
        double acceleratorMemoryPercent,
        double cpuTrendWarningPercent,
        int trendWindow,
        long responseTimeWarningMs,
        long serviceMemoryWarningMb
) {

    public static HealthThresholds defaults() {
        return from(new ServiceConfig.HealthConfig());
    }

    public static HealthThresholds from(ServiceConfig.HealthConfig config) {
        return new HealthThresholds(
                config.getCpuWarningPercent(),
                config.getCpuCriticalPercent(),
                config.getMemoryWarningPercent(),
                config.getMemoryCriticalPercent(),
                config.getDiskWarningPercent(),
                config.getDiskCriticalPercent(),
                config.getProcessCountWarning(),
                config.getTemperatureWarningCelsius(),
                config.getMemoryPressurePercent(),
                config.getDiskPerformancePercent(),
                config.getAcceleratorMemoryPercent(),
                config.getCpuTrendWarningPercent(),
                config.getTrendWindow(),
                config.getResponseTimeWarningMs(),
                config.getServiceMemoryWarningMb()
        );
    }
}
