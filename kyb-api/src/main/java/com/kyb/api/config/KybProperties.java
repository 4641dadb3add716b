package com.kyb.api.config;

import com.kyb.client.FixtureRiskCheckGateway;
import com.kyb.client.HttpRiskCheckGateway;
import com.kyb.engine.coordinator.StepDelay;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Dashboard settings under the {@code kyb} prefix.
 */
@ConfigurationProperties(prefix = "kyb")
public class KybProperties {

    private Remote remote = new Remote();
    private Run run = new Run();
    private Storage storage = new Storage();
    private List<CustomerEntry> customers = new ArrayList<>();

    public Remote getRemote() {
        return remote;
    }

    public void setRemote(Remote remote) {
        this.remote = remote;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public List<CustomerEntry> getCustomers() {
        return customers;
    }

    public void setCustomers(List<CustomerEntry> customers) {
        this.customers = customers;
    }

    /**
     * Where KYB checks are run.
     */
    public static class Remote {
        private Mode mode = Mode.HTTP;
        private String baseUrl = "http://localhost:8080";
        private Duration connectTimeout = HttpRiskCheckGateway.DEFAULT_TIMEOUT;
        private Duration requestTimeout = HttpRiskCheckGateway.DEFAULT_TIMEOUT;
        private String fixture = FixtureRiskCheckGateway.DEFAULT_RESOURCE;

        public enum Mode {
            HTTP, FIXTURE
        }

        public Mode getMode() {
            return mode;
        }

        public void setMode(Mode mode) {
            this.mode = mode;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public String getFixture() {
            return fixture;
        }

        public void setFixture(String fixture) {
            this.fixture = fixture;
        }
    }

    public static class Run {
        private Duration stepDelay = StepDelay.DEFAULT_INTERVAL;

        public Duration getStepDelay() {
            return stepDelay;
        }

        public void setStepDelay(Duration stepDelay) {
            this.stepDelay = stepDelay;
        }
    }

    /**
     * Local persistence of history, last-run customer and cached result.
     */
    public static class Storage {
        private Mode mode = Mode.MEMORY;
        private String directory = "./data/kyb";

        public enum Mode {
            MEMORY, FILE
        }

        public Mode getMode() {
            return mode;
        }

        public void setMode(Mode mode) {
            this.mode = mode;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    public static class CustomerEntry {
        private String id;
        private String name;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }
}
