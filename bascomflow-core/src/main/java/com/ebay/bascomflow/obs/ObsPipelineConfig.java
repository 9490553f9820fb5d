/************************************************************************
 Copyright 2018 eBay Inc.
 Author/Developer: Brendan McCarthy

 Licensed under the Apache License, Version 2.0 (the "License");
 you may not use this file except in compliance with the License.
 You may obtain a copy of the License at

 https://www.apache.org/licenses/LICENSE-2.0

 Unless required by applicable law or agreed to in writing, software
 distributed under the License is distributed on an "AS IS" BASIS,
 WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 See the License for the specific language governing permissions and
 limitations under the License.
 **************************************************************************/
package com.ebay.bascomflow.obs;

import com.ebay.bascomflow.core.RetryPolicy;
import com.ebay.bascomflow.exceptions.PipelineConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

/**
 * Settings of the observation pipeline. Every setting has a default, which a properties file can override,
 * which in turn a {@code BASCOMFLOW_*} environment variable can override. The variable name is the key upper-cased
 * with dots replaced by underscores, e.g. {@code BASCOMFLOW_GATE_OCCUPANCY_MAX} for {@code gate.occupancy.max}.
 *
 * @author Brendan McCarthy
 */
public final class ObsPipelineConfig {
    private static final Logger LOG = LoggerFactory.getLogger(ObsPipelineConfig.class);

    public static final String ENV_PREFIX = "BASCOMFLOW_";
    public static final String COMMAND_PREFIX = "command.";
    public static final String POOL_PREFIX = "pool.";

    static final String CACHE_DIR = "cache.dir";
    static final String RESULTS_DIR = "results.dir";
    static final String POINTINGS = "gate.pointings";
    static final String DATAQUALITY_MAX = "gate.dataquality.max";
    static final String BADTILES_MAX = "gate.badtiles.max";
    static final String DEADDIPOLES_MAX = "gate.deaddipoles.max";
    static final String OCCUPANCY_MAX = "gate.occupancy.max";
    static final String VARIANTS = "calibration.variants";
    static final String DOWNLOAD_MAX_ATTEMPTS = "download.maxAttempts";
    static final String DOWNLOAD_BACKOFF_BASE = "download.backoff.base";
    static final String DOWNLOAD_BACKOFF_UNIT = "download.backoff.unit";

    private static final Map<String, String> DEFAULTS = new LinkedHashMap<>();

    static {
        DEFAULTS.put(CACHE_DIR, "cache");
        DEFAULTS.put(RESULTS_DIR, "results");
        DEFAULTS.put(POINTINGS, "-2,-1,0,1,2");
        DEFAULTS.put(DATAQUALITY_MAX, "1");
        DEFAULTS.put(BADTILES_MAX, "0.1");
        DEFAULTS.put(DEADDIPOLES_MAX, "0.05");
        DEFAULTS.put(OCCUPANCY_MAX, "0.25");
        DEFAULTS.put(VARIANTS, "30l_src4k,30l_src8k");
        DEFAULTS.put(DOWNLOAD_MAX_ATTEMPTS, "5");
        DEFAULTS.put(DOWNLOAD_BACKOFF_BASE, "2");
        DEFAULTS.put(DOWNLOAD_BACKOFF_UNIT, "HOURS");
        DEFAULTS.put(COMMAND_PREFIX + ObsStages.METADATA, "obs-metadata {obsid} {dir}/{obsid}_metadata.json");
        DEFAULTS.put(COMMAND_PREFIX + ObsStages.DOWNLOAD, "obs-download {obsid} {dir}/raw");
        DEFAULTS.put(COMMAND_PREFIX + ObsStages.PREPROCESS,
                "obs-preprocess {input} {dir}/{obsid}.ms {dir}/{obsid}_occupancy.json");
        DEFAULTS.put(COMMAND_PREFIX + ObsStages.CALIBRATE, "obs-calibrate {input} {dir} {variants}");
        DEFAULTS.put(COMMAND_PREFIX + ObsStages.APPLY, "obs-apply {input} {solution} {dir}/{obsid}_{variant}.ms");
        DEFAULTS.put(COMMAND_PREFIX + ObsStages.CALQA, "obs-calqa {input} {dir}/calqa_{obsid}_{variant}.json");
        DEFAULTS.put(COMMAND_PREFIX + ObsStages.IMGQA, "obs-imgqa {input} {dir}/imgqa_{obsid}_{variant}.json");
        DEFAULTS.put(POOL_PREFIX + ObsStages.IO_CLASS, "4");
        DEFAULTS.put(POOL_PREFIX + ObsStages.COMPUTE_CLASS, "2");
    }

    private Path cacheDir;
    private Path resultsDir;
    private Set<Integer> pointings;
    private int maxDataQuality;
    private double maxBadTiles;
    private double maxDeadDipoles;
    private double maxOccupancy;
    private List<String> variants;
    private int downloadMaxAttempts;
    private double downloadBackoffBase;
    private TimeUnit downloadBackoffUnit;
    private final Map<String, String> commands = new LinkedHashMap<>();
    private final Map<String, Integer> pools = new LinkedHashMap<>();

    private ObsPipelineConfig(Map<String, String> values) {
        cacheDir = Paths.get(values.get(CACHE_DIR));
        resultsDir = Paths.get(values.get(RESULTS_DIR));
        pointings = parseInts(POINTINGS, values.get(POINTINGS));
        maxDataQuality = parseInt(DATAQUALITY_MAX, values.get(DATAQUALITY_MAX));
        maxBadTiles = parseDouble(BADTILES_MAX, values.get(BADTILES_MAX));
        maxDeadDipoles = parseDouble(DEADDIPOLES_MAX, values.get(DEADDIPOLES_MAX));
        maxOccupancy = parseDouble(OCCUPANCY_MAX, values.get(OCCUPANCY_MAX));
        variants = parseList(VARIANTS, values.get(VARIANTS));
        downloadMaxAttempts = parseInt(DOWNLOAD_MAX_ATTEMPTS, values.get(DOWNLOAD_MAX_ATTEMPTS));
        downloadBackoffBase = parseDouble(DOWNLOAD_BACKOFF_BASE, values.get(DOWNLOAD_BACKOFF_BASE));
        downloadBackoffUnit = parseUnit(DOWNLOAD_BACKOFF_UNIT, values.get(DOWNLOAD_BACKOFF_UNIT));
        for (Map.Entry<String, String> next : values.entrySet()) {
            String key = next.getKey();
            if (key.startsWith(COMMAND_PREFIX)) {
                commands.put(key.substring(COMMAND_PREFIX.length()), next.getValue().trim());
            } else if (key.startsWith(POOL_PREFIX)) {
                int slots = parseInt(key, next.getValue());
                if (slots < 1) {
                    throw new PipelineConfigurationException("Invalid value for " + key + ": at least one slot required");
                }
                pools.put(key.substring(POOL_PREFIX.length()), slots);
            } else if (!DEFAULTS.containsKey(key)) {
                LOG.warn("Ignoring unknown configuration key {}", key);
            }
        }
        if (downloadMaxAttempts < 1) {
            throw new PipelineConfigurationException("Invalid value for " + DOWNLOAD_MAX_ATTEMPTS + ": " + downloadMaxAttempts);
        }
        if (downloadBackoffBase < 1) {
            throw new PipelineConfigurationException("Invalid value for " + DOWNLOAD_BACKOFF_BASE + ": " + downloadBackoffBase);
        }
        if (variants.isEmpty()) {
            throw new PipelineConfigurationException("No calibration variants configured in " + VARIANTS);
        }
    }

    public static ObsPipelineConfig defaults() {
        return new ObsPipelineConfig(DEFAULTS);
    }

    /**
     * Creates configuration from defaults overridden by properties then by environment variables.
     *
     * @param properties overrides, may be empty
     * @param env        environment, usually {@code System.getenv()}
     * @return configuration
     * @throws PipelineConfigurationException if a value is invalid
     */
    public static ObsPipelineConfig fromProperties(Properties properties, Map<String, String> env) {
        Map<String, String> values = new LinkedHashMap<>(DEFAULTS);
        for (String next : properties.stringPropertyNames()) {
            values.put(next, properties.getProperty(next));
        }
        for (Map.Entry<String, String> next : env.entrySet()) {
            String name = next.getKey();
            if (name.startsWith(ENV_PREFIX)) {
                String key = keyOf(name.substring(ENV_PREFIX.length()), values.keySet());
                if (key == null) {
                    LOG.warn("Ignoring unknown environment variable {}", name);
                } else {
                    values.put(key, next.getValue());
                }
            }
        }
        return new ObsPipelineConfig(values);
    }

    /**
     * Reads a properties file, applying environment overrides.
     *
     * @param file properties
     * @param env  environment, usually {@code System.getenv()}
     * @return configuration
     * @throws PipelineConfigurationException if the file cannot be read or a value is invalid
     */
    public static ObsPipelineConfig load(Path file, Map<String, String> env) {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new PipelineConfigurationException("Cannot read configuration " + file, e);
        }
        LOG.info("Loaded configuration from {}", file);
        return fromProperties(properties, env);
    }

    static String envNameOf(String key) {
        return ENV_PREFIX + key.toUpperCase(Locale.ROOT).replace('.', '_');
    }

    private static String keyOf(String suffix, Set<String> known) {
        for (String next : known) {
            if (envNameOf(next).equals(ENV_PREFIX + suffix)) {
                return next;
            }
        }
        String upperCommand = COMMAND_PREFIX.toUpperCase(Locale.ROOT).replace('.', '_');
        String upperPool = POOL_PREFIX.toUpperCase(Locale.ROOT).replace('.', '_');
        if (suffix.startsWith(upperCommand) && suffix.length() > upperCommand.length()) {
            return COMMAND_PREFIX + suffix.substring(upperCommand.length()).toLowerCase(Locale.ROOT);
        }
        if (suffix.startsWith(upperPool) && suffix.length() > upperPool.length()) {
            return POOL_PREFIX + suffix.substring(upperPool.length()).toLowerCase(Locale.ROOT);
        }
        return null;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new PipelineConfigurationException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new PipelineConfigurationException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static List<String> parseList(String key, String value) {
        List<String> result = new ArrayList<>();
        for (String next : value.split(",")) {
            String item = next.trim();
            if (!item.isEmpty()) {
                if (result.contains(item)) {
                    throw new PipelineConfigurationException("Duplicate entry in " + key + ": " + item);
                }
                result.add(item);
            }
        }
        return Collections.unmodifiableList(result);
    }

    private static Set<Integer> parseInts(String key, String value) {
        Set<Integer> result = new TreeSet<>();
        for (String next : parseList(key, value)) {
            result.add(parseInt(key, next));
        }
        return Collections.unmodifiableSet(result);
    }

    private static TimeUnit parseUnit(String key, String value) {
        try {
            return TimeUnit.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new PipelineConfigurationException("Invalid value for " + key + ": " + value
                    + ", expected one of " + Arrays.toString(TimeUnit.values()), e);
        }
    }

    public Path getCacheDir() {
        return cacheDir;
    }

    public Path getResultsDir() {
        return resultsDir;
    }

    public Set<Integer> getPointings() {
        return pointings;
    }

    public int getMaxDataQuality() {
        return maxDataQuality;
    }

    public double getMaxBadTiles() {
        return maxBadTiles;
    }

    public double getMaxDeadDipoles() {
        return maxDeadDipoles;
    }

    public double getMaxOccupancy() {
        return maxOccupancy;
    }

    public List<String> getVariants() {
        return variants;
    }

    /**
     * @param stage name
     * @return command template of stage
     * @throws PipelineConfigurationException if none is configured
     */
    public String getCommand(String stage) {
        String command = commands.get(stage);
        if (command == null || command.isEmpty()) {
            throw new PipelineConfigurationException("No command configured for stage " + stage);
        }
        return command;
    }

    /**
     * @return slots per resource class
     */
    public Map<String, Integer> getPools() {
        return Collections.unmodifiableMap(pools);
    }

    /**
     * Policy of the download stage, which distinguishes the archive client's transient failures from the
     * ones that retrying cannot fix.
     *
     * @return download retry policy
     */
    public RetryPolicy getDownloadPolicy() {
        return RetryPolicy.builder()
                .ignore(2, "invalid arguments / observation")
                .ignore(28, "no space left on device")
                .ignore(99, "checksum mismatch")
                .retry(1, "general error")
                .retry(11, "resource temporarily unavailable")
                .retry(42, "rate limited by archive")
                .retry(75, "temporary failure")
                .maxAttempts(downloadMaxAttempts)
                .backoff(downloadBackoffBase, downloadBackoffUnit)
                .build();
    }

    public ObsPipelineConfig withCacheDir(Path dir) {
        this.cacheDir = dir;
        return this;
    }

    public ObsPipelineConfig withResultsDir(Path dir) {
        this.resultsDir = dir;
        return this;
    }

    public ObsPipelineConfig withPointings(Integer... pointings) {
        this.pointings = Collections.unmodifiableSet(new TreeSet<>(Arrays.asList(pointings)));
        return this;
    }

    public ObsPipelineConfig withVariants(String... variants) {
        this.variants = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(Arrays.asList(variants))));
        return this;
    }

    public ObsPipelineConfig withMaxOccupancy(double max) {
        this.maxOccupancy = max;
        return this;
    }

    public ObsPipelineConfig withDownloadBackoff(int maxAttempts, double base, TimeUnit unit) {
        this.downloadMaxAttempts = maxAttempts;
        this.downloadBackoffBase = base;
        this.downloadBackoffUnit = unit;
        return this;
    }

    @Override
    public String toString() {
        return "ObsPipelineConfig{cache=" + cacheDir + ", results=" + resultsDir + ", variants=" + variants
                + ", pointings=" + pointings + ", pools=" + pools + "}";
    }
}
