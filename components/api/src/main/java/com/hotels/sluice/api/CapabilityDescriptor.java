/*
  Copyright (C) 2013-2021 Expedia Inc.

  Licensed under the Apache License, Version 2.0 (the "License");
  you may not use this file except in compliance with the License.
  You may obtain a copy of the License at

  http://www.apache.org/licenses/LICENSE-2.0

  Unless required by applicable law or agreed to in writing, software
  distributed under the License is distributed on an "AS IS" BASIS,
  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
  See the License for the specific language governing permissions and
  limitations under the License.
 */
package com.hotels.sluice.api;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.hotels.sluice.api.exceptions.ConfigurationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.hotels.sluice.api.FailurePolicy.FAIL_CLOSED;
import static java.util.Objects.requireNonNull;

/**
 * Static plugin metadata: identity, the stages the plugin intercepts, and the failure policy
 * of each stage.
 * <p>
 * A descriptor must name at least one stage. It is produced once when the plugin is
 * registered and stays the same for the lifetime of the process.
 */
public final class CapabilityDescriptor {
    private final String name;
    private final String version;
    private final String description;
    private final ImmutableMap<Stage, FailurePolicy> stages;

    private CapabilityDescriptor(Builder builder) {
        this.name = builder.name;
        this.version = builder.version;
        this.description = builder.description;
        this.stages = ImmutableMap.copyOf(builder.stages);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public String name() {
        return name;
    }

    public String version() {
        return version;
    }

    public Optional<String> description() {
        return Optional.ofNullable(description);
    }

    public ImmutableSet<Stage> supportedStages() {
        return stages.keySet();
    }

    public boolean supports(Stage stage) {
        return stages.containsKey(stage);
    }

    /**
     * Returns the failure policy declared for a stage.
     *
     * @param stage a supported stage
     * @return failure policy
     * @throws IllegalArgumentException if the stage is not supported
     */
    public FailurePolicy failurePolicy(Stage stage) {
        FailurePolicy policy = stages.get(stage);
        if (policy == null) {
            throw new IllegalArgumentException("Stage " + stage + " is not supported by " + name);
        }
        return policy;
    }

    public ImmutableMap<Stage, FailurePolicy> failurePolicies() {
        return stages;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CapabilityDescriptor that = (CapabilityDescriptor) o;
        return name.equals(that.name)
                && version.equals(that.version)
                && Objects.equals(description, that.description)
                && stages.equals(that.stages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version, description, stages);
    }

    @Override
    public String toString() {
        return "CapabilityDescriptor{"
                + "name=" + name
                + ", version=" + version
                + ", stages=" + stages
                + '}';
    }

    /**
     * Builds {@link CapabilityDescriptor}s.
     */
    public static final class Builder {
        private String name;
        private String version;
        private String description;
        private final Map<Stage, FailurePolicy> stages = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder name(String name) {
            this.name = requireNonNull(name);
            return this;
        }

        public Builder version(String version) {
            this.version = requireNonNull(version);
            return this;
        }

        public Builder description(String description) {
            this.description = requireNonNull(description);
            return this;
        }

        /**
         * Declares a stage with the default {@link FailurePolicy#FAIL_CLOSED} policy.
         *
         * @param stage stage
         * @return this builder
         */
        public Builder stage(Stage stage) {
            return stage(stage, FAIL_CLOSED);
        }

        public Builder stage(Stage stage, FailurePolicy policy) {
            this.stages.put(requireNonNull(stage), requireNonNull(policy));
            return this;
        }

        /**
         * Builds the descriptor.
         *
         * @return a new descriptor
         * @throws ConfigurationException if the name or version is missing, or no stage is declared
         */
        public CapabilityDescriptor build() {
            if (name == null || name.isEmpty()) {
                throw new ConfigurationException("Plugin descriptor has no name");
            }
            if (version == null || version.isEmpty()) {
                throw new ConfigurationException("Plugin descriptor '" + name + "' has no version");
            }
            if (stages.isEmpty()) {
                throw new ConfigurationException("Plugin '" + name + "' declares no stages");
            }
            return new CapabilityDescriptor(this);
        }
    }
}
