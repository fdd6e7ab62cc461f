package com.vrwx.services.module;

import com.vrwx.core.domain.ServiceType;
import com.vrwx.services.manifest.ExecutionManifest;
import com.vrwx.services.manifest.ExecutionManifest.Patrol;
import com.vrwx.services.manifest.JobSpec;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.vrwx.services.module.ModuleSupport.*;

/**
 * Security patrol: the robot visits checkpoints and dwells at each for a minimum time.
 * Quality is 70 points for required checkpoints visited plus 30 for dwell compliance.
 */
public final class PatrolModule implements ServiceModule {

    static final long DEFAULT_MIN_DWELL_SECONDS = 30;
    static final long DEFAULT_DURATION_SECONDS = 600;

    private final Clock clock;

    public PatrolModule(Clock clock) {
        this.clock = clock;
    }

    public PatrolModule() {
        this(Clock.systemUTC());
    }

    @Override
    public ServiceType id() {
        return ServiceType.SECURITY_PATROL;
    }

    @Override
    public String label() {
        return "Security Patrol";
    }

    @Override
    public String description() {
        return "Security patrol service - robot visits checkpoints with minimum dwell time at each";
    }

    @Override
    public List<String> requiredCapabilities() {
        return List.of("navigation", "localization", "patrol_mode");
    }

    @Override
    public BigDecimal baseRateUsd() {
        return BigDecimal.valueOf(150);
    }

    @Override
    public void validateSpec(JobSpec jobSpec) {
        requireSpec(ServiceType.SECURITY_PATROL, jobSpec);
    }

    @Override
    public void validateManifest(ExecutionManifest manifest) {
        requireManifest(ServiceType.SECURITY_PATROL, manifest);
        Patrol patrol = manifest.patrol();
        if (patrol == null) {
            throw new ManifestValidationException("Missing required field: manifest.patrol");
        }
        if (patrol.checkpointsVisited() == null) {
            throw new ManifestValidationException("Missing required field: manifest.patrol.checkpointsVisited");
        }
        if (patrol.dwellSeconds() == null) {
            throw new ManifestValidationException("Missing required field: manifest.patrol.dwellSeconds");
        }
        if (patrol.checkpointsVisited().size() != patrol.dwellSeconds().size()) {
            throw new ManifestValidationException(
                    "manifest.patrol.checkpointsVisited and dwellSeconds must have same length");
        }
    }

    @Override
    public ExecutionManifest buildManifest(List<Map<String, Object>> events, JobSpec jobSpec,
                                           long jobId, String robotId, String controller) {
        long startTs = 0;
        long endTs = 0;
        List<String> visited = new ArrayList<>();
        List<Long> dwell = new ArrayList<>();
        List<String> required = null;
        Long minDwell = null;
        String routeDigest = null;

        for (Map<String, Object> event : events) {
            String type = type(event);
            if ("checkpoint".equals(type)) {
                visited.add(getString(event, "checkpointId"));
                dwell.add(getLong(event, "dwellSeconds", 0));
            } else if ("config".equals(type)) {
                List<Object> configured = getList(event, "checkpointsRequired");
                if (configured != null) {
                    required = asStrings(configured);
                }
                if (event.get("minDwellRequired") instanceof Number) {
                    minDwell = ((Number) event.get("minDwellRequired")).longValue();
                }
            } else if ("start".equals(type)) {
                startTs = getLong(event, "timestamp", 0);
            } else if ("end".equals(type)) {
                endTs = getLong(event, "timestamp", 0);
            } else if ("route".equals(type)) {
                routeDigest = getString(event, "digest");
            }
        }

        long now = clock.instant().getEpochSecond();
        if (startTs == 0) startTs = now - DEFAULT_DURATION_SECONDS;
        if (endTs == 0) endTs = now;

        if (required == null) {
            required = checkpointsFromSpec(jobSpec);
        }

        return new ExecutionManifest(null, null, null, jobId, robotId, controller,
                ServiceType.SECURITY_PATROL, startTs, endTs, routeDigest, null, null,
                new Patrol(required, visited, dwell, minDwell), null);
    }

    @Override
    public int computeQualityScore(ExecutionManifest manifest, JobSpec jobSpec) {
        Patrol patrol = manifest.patrol();
        if (patrol == null || patrol.checkpointsVisited() == null) return 0;

        List<String> visited = patrol.checkpointsVisited();
        List<String> required = patrol.checkpointsRequired();
        if (required == null) {
            required = checkpointsFromSpec(jobSpec);
        }
        if (required == null) {
            // every visited checkpoint counts as required
            required = visited;
        }
        if (required.isEmpty()) return ServiceModule.MAX_QUALITY;

        Set<String> visitedSet = new HashSet<>(visited);
        long visitedRequired = required.stream().filter(visitedSet::contains).count();
        double checkpointScore = (double) visitedRequired / required.size() * 70;

        long minDwell = minDwell(patrol, jobSpec);
        int compliant = 0;
        List<Long> dwell = patrol.dwellSeconds() == null ? List.of() : patrol.dwellSeconds();
        for (int i = 0; i < visited.size() && i < dwell.size(); i++) {
            Long seconds = dwell.get(i);
            if (seconds != null && seconds >= minDwell) {
                compliant++;
            }
        }
        double dwellRatio = visited.isEmpty() ? 0 : (double) compliant / visited.size();

        return clampQuality(checkpointScore + dwellRatio * 30);
    }

    @Override
    public int computeWorkUnits(ExecutionManifest manifest, JobSpec jobSpec) {
        Patrol patrol = manifest.patrol();
        if (patrol == null || patrol.checkpointsVisited() == null) return 0;
        return clampWorkUnits(patrol.checkpointsVisited().size());
    }

    private static long minDwell(Patrol patrol, JobSpec jobSpec) {
        if (patrol.minDwellRequired() != null && patrol.minDwellRequired() != 0) {
            return patrol.minDwellRequired();
        }
        if (jobSpec != null) {
            Object fromSpec = jobSpec.param("minDwellSeconds").orElse(null);
            if (fromSpec instanceof Number && ((Number) fromSpec).longValue() != 0) {
                return ((Number) fromSpec).longValue();
            }
        }
        return DEFAULT_MIN_DWELL_SECONDS;
    }

    private static List<String> checkpointsFromSpec(JobSpec jobSpec) {
        if (jobSpec == null) return null;
        Object checkpoints = jobSpec.param("checkpoints").orElse(null);
        if (checkpoints instanceof List) {
            return asStrings((List<?>) checkpoints);
        }
        return null;
    }

    private static List<String> asStrings(List<?> values) {
        return values.stream().map(String::valueOf).collect(Collectors.toList());
    }
}
