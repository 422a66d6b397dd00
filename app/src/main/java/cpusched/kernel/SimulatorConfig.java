package cpusched.kernel;

import cpusched.Enum.PriorityOrder;
import cpusched.Exception.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Simulator configuration: which policy to run and its parameters.
 */
public class SimulatorConfig {

    /**
     * Resource loaded by {@link #loadDefault()}.
     */
    public static final String DEFAULT_RESOURCE = "/simulator.properties";

    public enum PolicyType {
        FCFS("FCFS"),
        SJF("SJF (NP)"),
        SRTF("SJF (P)"),
        ROUND_ROBIN("Round Robin"),
        PRIORITY("Priority (NP)"),
        PRIORITY_PREEMPTIVE("Priority (P)"),
        MLFQ("MLFQ"),
        INTELLIGENT("Intelligent");

        private final String displayName;

        PolicyType(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }

        /**
         * Accepts enum names case-insensitively plus the short names
         * used on the command line (rr, sjf-p, pr-np, ...).
         */
        public static PolicyType parse(String value) throws ConfigurationException {
            if (value == null) {
                throw new ConfigurationException("Policy name is missing");
            }
            String key = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
            switch (key) {
                case "RR":
                    return ROUND_ROBIN;
                case "SJF_NP":
                    return SJF;
                case "SJF_P":
                    return SRTF;
                case "PR_NP":
                    return PRIORITY;
                case "PR_P":
                    return PRIORITY_PREEMPTIVE;
                default:
                    try {
                        return valueOf(key);
                    } catch (IllegalArgumentException e) {
                        throw new ConfigurationException("Unknown scheduling policy: " + value, e);
                    }
            }
        }
    }

    private PolicyType policyType = PolicyType.ROUND_ROBIN;
    private int quantum = 2;
    private PriorityOrder priorityOrder = PriorityOrder.LOWER_IS_HIGHER;
    private int feedbackLevels = 3;

    // Intelligent scheduler weights
    private double waitWeight = 1.0;
    private double burstWeight = 1.0;
    private double priorityWeight = 0.5;
    private int starvationThreshold = 10;

    public SimulatorConfig() {
    }

    public SimulatorConfig(PolicyType policyType) {
        this.policyType = policyType;
    }

    /**
     * Copy constructor
     */
    public SimulatorConfig(SimulatorConfig other) {
        this.policyType = other.policyType;
        this.quantum = other.quantum;
        this.priorityOrder = other.priorityOrder;
        this.feedbackLevels = other.feedbackLevels;
        this.waitWeight = other.waitWeight;
        this.burstWeight = other.burstWeight;
        this.priorityWeight = other.priorityWeight;
        this.starvationThreshold = other.starvationThreshold;
    }

    /**
     * Reject parameter combinations no scheduler can run with.
     */
    public void validate() throws ConfigurationException {
        if (policyType == null) {
            throw new ConfigurationException("No scheduling policy selected");
        }
        if (quantum <= 0) {
            throw new ConfigurationException("Quantum must be a positive integer, got " + quantum);
        }
        if (priorityOrder == null) {
            throw new ConfigurationException("Priority order must be set");
        }
        if (feedbackLevels <= 0) {
            throw new ConfigurationException("Feedback queue needs at least one level, got " + feedbackLevels);
        }
        if (waitWeight < 0 || burstWeight < 0 || priorityWeight < 0) {
            throw new ConfigurationException("Intelligent scheduler weights must be >= 0");
        }
        if (starvationThreshold <= 0) {
            throw new ConfigurationException("Starvation threshold must be > 0, got " + starvationThreshold);
        }
    }

    /**
     * Load the bundled defaults from {@value #DEFAULT_RESOURCE}, falling back
     * to the built-in values if the resource is absent.
     */
    public static SimulatorConfig loadDefault() throws ConfigurationException {
        try (InputStream in = SimulatorConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return new SimulatorConfig();
            }
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Read a configuration from a properties stream. Missing keys keep
     * their defaults.
     */
    public static SimulatorConfig load(InputStream in) throws IOException, ConfigurationException {
        Properties props = new Properties();
        props.load(in);
        return fromProperties(props);
    }

    public static SimulatorConfig fromProperties(Properties props) throws ConfigurationException {
        SimulatorConfig config = new SimulatorConfig();
        String policy = props.getProperty("scheduler.policy");
        if (policy != null) {
            config.setPolicyType(PolicyType.parse(policy));
        }
        config.setQuantum(intProperty(props, "scheduler.quantum", config.getQuantum()));
        String order = props.getProperty("scheduler.priorityOrder");
        if (order != null) {
            try {
                config.setPriorityOrder(PriorityOrder.valueOf(order.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown priority order: " + order, e);
            }
        }
        config.setFeedbackLevels(intProperty(props, "scheduler.mlfq.levels", config.getFeedbackLevels()));
        config.setWaitWeight(doubleProperty(props, "scheduler.intelligent.waitWeight", config.getWaitWeight()));
        config.setBurstWeight(doubleProperty(props, "scheduler.intelligent.burstWeight", config.getBurstWeight()));
        config.setPriorityWeight(
                doubleProperty(props, "scheduler.intelligent.priorityWeight", config.getPriorityWeight()));
        config.setStarvationThreshold(
                intProperty(props, "scheduler.intelligent.starvationThreshold", config.getStarvationThreshold()));
        config.validate();
        return config;
    }

    private static int intProperty(Properties props, String key, int fallback) throws ConfigurationException {
        String value = props.getProperty(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Property " + key + " is not an integer: " + value, e);
        }
    }

    private static double doubleProperty(Properties props, String key, double fallback)
            throws ConfigurationException {
        String value = props.getProperty(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Property " + key + " is not a number: " + value, e);
        }
    }

    // Getters and setters
    public PolicyType getPolicyType() {
        return policyType;
    }

    public void setPolicyType(PolicyType policyType) {
        this.policyType = policyType;
    }

    public int getQuantum() {
        return quantum;
    }

    public void setQuantum(int quantum) {
        this.quantum = quantum;
    }

    public PriorityOrder getPriorityOrder() {
        return priorityOrder;
    }

    public void setPriorityOrder(PriorityOrder priorityOrder) {
        this.priorityOrder = priorityOrder;
    }

    public int getFeedbackLevels() {
        return feedbackLevels;
    }

    public void setFeedbackLevels(int feedbackLevels) {
        this.feedbackLevels = feedbackLevels;
    }

    public double getWaitWeight() {
        return waitWeight;
    }

    public void setWaitWeight(double waitWeight) {
        this.waitWeight = waitWeight;
    }

    public double getBurstWeight() {
        return burstWeight;
    }

    public void setBurstWeight(double burstWeight) {
        this.burstWeight = burstWeight;
    }

    public double getPriorityWeight() {
        return priorityWeight;
    }

    public void setPriorityWeight(double priorityWeight) {
        this.priorityWeight = priorityWeight;
    }

    public int getStarvationThreshold() {
        return starvationThreshold;
    }

    public void setStarvationThreshold(int starvationThreshold) {
        this.starvationThreshold = starvationThreshold;
    }
}
