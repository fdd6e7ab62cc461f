package com.vrwx.services.module;

import com.vrwx.core.domain.ServiceType;
import com.vrwx.services.manifest.ExecutionManifest;
import com.vrwx.services.manifest.JobSpec;

import java.util.List;
import java.util.Map;

/**
 * Checks and event accessors shared by the service modules.
 */
final class ModuleSupport {

    private ModuleSupport() {}

    static void requireSpec(ServiceType expected, JobSpec jobSpec) {
        if (jobSpec == null) {
            throw new ManifestValidationException("Missing job spec");
        }
        if (jobSpec.serviceType() != expected) {
            throw new ManifestValidationException("Invalid serviceType: expected '" + expected.id()
                    + "', got '" + idOf(jobSpec.serviceType()) + "'");
        }
        if (jobSpec.geoCell() == null || jobSpec.geoCell().isEmpty()) {
            throw new ManifestValidationException("Missing required field: geoCell");
        }
        if (jobSpec.qualityMin() < 0 || jobSpec.qualityMin() > ServiceModule.MAX_QUALITY) {
            throw new ManifestValidationException(
                    "Invalid qualityMin: must be 0-100, got " + jobSpec.qualityMin());
        }
    }

    static void requireManifest(ServiceType expected, ExecutionManifest manifest) {
        if (manifest == null) {
            throw new ManifestValidationException("Missing manifest");
        }
        if (manifest.serviceType() != expected) {
            throw new ManifestValidationException("Invalid manifest serviceType: expected '"
                    + expected.id() + "', got '" + idOf(manifest.serviceType()) + "'");
        }
    }

    static int clampQuality(double score) {
        return (int) Math.max(0, Math.min(ServiceModule.MAX_QUALITY, Math.round(score)));
    }

    static int clampWorkUnits(long units) {
        return (int) Math.max(0, Math.min(Integer.MAX_VALUE, units));
    }

    private static String idOf(ServiceType type) {
        return type == null ? "null" : type.id();
    }

    // ==================== Event accessors ====================

    static String type(Map<String, Object> event) {
        return getString(event, "type");
    }

    static String getString(Map<String, Object> event, String key) {
        Object value = event.get(key);
        return value != null ? value.toString() : null;
    }

    static String getString(Map<String, Object> event, String key, String defaultValue) {
        String value = getString(event, key);
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    /**
     * Numeric field, or {@code null} when absent, zero or not a number.
     */
    static Long getLong(Map<String, Object> event, String key) {
        Object value = event.get(key);
        if (value == null) return null;
        long parsed;
        if (value instanceof Number) {
            parsed = ((Number) value).longValue();
        } else {
            try {
                parsed = (long) Double.parseDouble(value.toString());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return parsed != 0 ? parsed : null;
    }

    static long getLong(Map<String, Object> event, String key, long defaultValue) {
        Long value = getLong(event, key);
        return value != null ? value : defaultValue;
    }

    @SuppressWarnings("unchecked")
    static List<Object> getList(Map<String, Object> event, String key) {
        Object value = event.get(key);
        if (value instanceof List) {
            return (List<Object>) value;
        }
        return null;
    }
}
