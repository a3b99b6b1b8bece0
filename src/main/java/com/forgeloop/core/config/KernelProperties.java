package com.forgeloop.core.config;

import com.forgeloop.core.model.Risk;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "forgeloop")
public class KernelProperties {

    private String repoRoot = ".";
    private String mainBranch = "main";
    private String workcellsDir = ".workcells";
    private String archivesDir = ".forgeloop/archives";
    private String graphFile = ".forgeloop/graph.json";
    private List<String> toolchainPriority = new ArrayList<>(List.of("codex", "claude"));
    private Map<String, Toolchain> toolchains = new LinkedHashMap<>();

    private Scheduling scheduling = new Scheduling();
    private Gates gates = new Gates();
    private Speculation speculation = new Speculation();
    private Routing routing = new Routing();
    private Control control = new Control();
    private Runner runner = new Runner();

    /** Configured settings for a toolchain, or defaults when it is not configured. */
    public Toolchain toolchain(String name) {
        Toolchain configured = toolchains.get(name);
        return configured != null ? configured : new Toolchain();
    }

    public String getRepoRoot() { return repoRoot; }
    public void setRepoRoot(String repoRoot) { this.repoRoot = repoRoot; }
    public String getMainBranch() { return mainBranch; }
    public void setMainBranch(String mainBranch) { this.mainBranch = mainBranch; }
    public String getWorkcellsDir() { return workcellsDir; }
    public void setWorkcellsDir(String workcellsDir) { this.workcellsDir = workcellsDir; }
    public String getArchivesDir() { return archivesDir; }
    public void setArchivesDir(String archivesDir) { this.archivesDir = archivesDir; }
    public String getGraphFile() { return graphFile; }
    public void setGraphFile(String graphFile) { this.graphFile = graphFile; }
    public List<String> getToolchainPriority() { return toolchainPriority; }
    public void setToolchainPriority(List<String> toolchainPriority) { this.toolchainPriority = toolchainPriority; }
    public Map<String, Toolchain> getToolchains() { return toolchains; }
    public void setToolchains(Map<String, Toolchain> toolchains) { this.toolchains = toolchains; }
    public Scheduling getScheduling() { return scheduling; }
    public void setScheduling(Scheduling scheduling) { this.scheduling = scheduling; }
    public Gates getGates() { return gates; }
    public void setGates(Gates gates) { this.gates = gates; }
    public Speculation getSpeculation() { return speculation; }
    public void setSpeculation(Speculation speculation) { this.speculation = speculation; }
    public Routing getRouting() { return routing; }
    public void setRouting(Routing routing) { this.routing = routing; }
    public Control getControl() { return control; }
    public void setControl(Control control) { this.control = control; }
    public Runner getRunner() { return runner; }
    public void setRunner(Runner runner) { this.runner = runner; }

    public static class Scheduling {
        private int maxConcurrentWorkcells = 3;
        private long maxConcurrentTokens = 200_000L;

        public int getMaxConcurrentWorkcells() { return maxConcurrentWorkcells; }
        public void setMaxConcurrentWorkcells(int maxConcurrentWorkcells) { this.maxConcurrentWorkcells = maxConcurrentWorkcells; }
        public long getMaxConcurrentTokens() { return maxConcurrentTokens; }
        public void setMaxConcurrentTokens(long maxConcurrentTokens) { this.maxConcurrentTokens = maxConcurrentTokens; }
    }

    public static class Toolchain {
        private boolean enabled = true;
        private List<String> command = new ArrayList<>();
        private String model;
        private int timeoutSeconds = 1800;
        private Map<String, String> env = new LinkedHashMap<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public Map<String, String> getEnv() { return env; }
        public void setEnv(Map<String, String> env) { this.env = env; }
    }

    /**
     * Gate commands. The three defaults apply to every issue without an explicit
     * override; {@code tagged} adds gates for issues carrying a given tag.
     */
    public static class Gates {
        private String testCommand = "pytest";
        private String typecheckCommand = "mypy .";
        private String lintCommand = "ruff check .";
        private Map<String, Map<String, String>> tagged = new LinkedHashMap<>();

        public String getTestCommand() { return testCommand; }
        public void setTestCommand(String testCommand) { this.testCommand = testCommand; }
        public String getTypecheckCommand() { return typecheckCommand; }
        public void setTypecheckCommand(String typecheckCommand) { this.typecheckCommand = typecheckCommand; }
        public String getLintCommand() { return lintCommand; }
        public void setLintCommand(String lintCommand) { this.lintCommand = lintCommand; }
        public Map<String, Map<String, String>> getTagged() { return tagged; }
        public void setTagged(Map<String, Map<String, String>> tagged) { this.tagged = tagged; }
    }

    public static class Speculation {
        private boolean enabled = true;
        private int defaultParallelism = 2;
        private int maxParallelism = 3;
        private List<Risk> riskLevels = new ArrayList<>(List.of(Risk.HIGH));

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getDefaultParallelism() { return defaultParallelism; }
        public void setDefaultParallelism(int defaultParallelism) { this.defaultParallelism = defaultParallelism; }
        public int getMaxParallelism() { return maxParallelism; }
        public void setMaxParallelism(int maxParallelism) { this.maxParallelism = maxParallelism; }
        public List<Risk> getRiskLevels() { return riskLevels; }
        public void setRiskLevels(List<Risk> riskLevels) { this.riskLevels = riskLevels; }
    }

    public static class Routing {
        private List<Rule> rules = new ArrayList<>();
        private Map<String, List<String>> fallbacks = new LinkedHashMap<>();

        public List<Rule> getRules() { return rules; }
        public void setRules(List<Rule> rules) { this.rules = rules; }
        public Map<String, List<String>> getFallbacks() { return fallbacks; }
        public void setFallbacks(Map<String, List<String>> fallbacks) { this.fallbacks = fallbacks; }
    }

    /**
     * Routing rule. All non-empty match fields must hold; the first matching rule wins.
     */
    public static class Rule {
        private Match match = new Match();
        private List<String> use = new ArrayList<>();
        private boolean speculate;
        private Integer parallelism;

        public Match getMatch() { return match; }
        public void setMatch(Match match) { this.match = match; }
        public List<String> getUse() { return use; }
        public void setUse(List<String> use) { this.use = use; }
        public boolean isSpeculate() { return speculate; }
        public void setSpeculate(boolean speculate) { this.speculate = speculate; }
        public Integer getParallelism() { return parallelism; }
        public void setParallelism(Integer parallelism) { this.parallelism = parallelism; }
    }

    public static class Match {
        private String toolHint;
        private Risk risk;
        private String size;
        private List<String> tagsAny = new ArrayList<>();
        private List<String> tagsAll = new ArrayList<>();
        private String titlePattern;
        private String descriptionPattern;

        public String getToolHint() { return toolHint; }
        public void setToolHint(String toolHint) { this.toolHint = toolHint; }
        public Risk getRisk() { return risk; }
        public void setRisk(Risk risk) { this.risk = risk; }
        public String getSize() { return size; }
        public void setSize(String size) { this.size = size; }
        public List<String> getTagsAny() { return tagsAny; }
        public void setTagsAny(List<String> tagsAny) { this.tagsAny = tagsAny; }
        public List<String> getTagsAll() { return tagsAll; }
        public void setTagsAll(List<String> tagsAll) { this.tagsAll = tagsAll; }
        public String getTitlePattern() { return titlePattern; }
        public void setTitlePattern(String titlePattern) { this.titlePattern = titlePattern; }
        public String getDescriptionPattern() { return descriptionPattern; }
        public void setDescriptionPattern(String descriptionPattern) { this.descriptionPattern = descriptionPattern; }
    }

    /**
     * Exploration controller bounds. The verified rate over the last {@code window}
     * transitions is compared against {@code actionLow} and {@code actionHigh}.
     */
    public static class Control {
        private boolean enabled = true;
        private double actionLow = 0.1;
        private double actionHigh = 0.5;
        private double temperatureBase = 0.2;
        private double temperatureMin = 0.1;
        private double temperatureMax = 0.6;
        private double temperatureStep = 0.1;
        private int parallelismStep = 1;
        private int window = 50;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public double getActionLow() { return actionLow; }
        public void setActionLow(double actionLow) { this.actionLow = actionLow; }
        public double getActionHigh() { return actionHigh; }
        public void setActionHigh(double actionHigh) { this.actionHigh = actionHigh; }
        public double getTemperatureBase() { return temperatureBase; }
        public void setTemperatureBase(double temperatureBase) { this.temperatureBase = temperatureBase; }
        public double getTemperatureMin() { return temperatureMin; }
        public void setTemperatureMin(double temperatureMin) { this.temperatureMin = temperatureMin; }
        public double getTemperatureMax() { return temperatureMax; }
        public void setTemperatureMax(double temperatureMax) { this.temperatureMax = temperatureMax; }
        public double getTemperatureStep() { return temperatureStep; }
        public void setTemperatureStep(double temperatureStep) { this.temperatureStep = temperatureStep; }
        public int getParallelismStep() { return parallelismStep; }
        public void setParallelismStep(int parallelismStep) { this.parallelismStep = parallelismStep; }
        public int getWindow() { return window; }
        public void setWindow(int window) { this.window = window; }
    }

    public static class Runner {
        private int pollIntervalSeconds = 5;
        private int shutdownGraceSeconds = 30;
        private int lanePoolSize = 8;
        private boolean dryRun;
        private boolean forceSpeculate;
        private boolean singleCycle;
        private String targetIssue;

        public int getPollIntervalSeconds() { return pollIntervalSeconds; }
        public void setPollIntervalSeconds(int pollIntervalSeconds) { this.pollIntervalSeconds = pollIntervalSeconds; }
        public int getShutdownGraceSeconds() { return shutdownGraceSeconds; }
        public void setShutdownGraceSeconds(int shutdownGraceSeconds) { this.shutdownGraceSeconds = shutdownGraceSeconds; }
        public int getLanePoolSize() { return lanePoolSize; }
        public void setLanePoolSize(int lanePoolSize) { this.lanePoolSize = lanePoolSize; }
        public boolean isDryRun() { return dryRun; }
        public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }
        public boolean isForceSpeculate() { return forceSpeculate; }
        public void setForceSpeculate(boolean forceSpeculate) { this.forceSpeculate = forceSpeculate; }
        public boolean isSingleCycle() { return singleCycle; }
        public void setSingleCycle(boolean singleCycle) { this.singleCycle = singleCycle; }
        public String getTargetIssue() { return targetIssue; }
        public void setTargetIssue(String targetIssue) { this.targetIssue = targetIssue; }
    }
}
