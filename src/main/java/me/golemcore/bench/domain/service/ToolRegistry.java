package me.golemcore.bench.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.bench.domain.component.ToolComponent;
import me.golemcore.bench.domain.model.ToolDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Explicit catalogue of the tools offered to the agent. Built once from the
 * enabled {@link ToolComponent} beans and read-only afterwards, so one registry
 * can serve any number of concurrent sessions.
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools;

    public ToolRegistry(Collection<? extends ToolComponent> components) {
        Map<String, ToolComponent> byName = new LinkedHashMap<>();
        for (ToolComponent component : components) {
            if (!component.isEnabled()) {
                log.info("[Tools] {} disabled, not registered", component.getToolName());
                continue;
            }
            ToolComponent previous = byName.putIfAbsent(component.getToolName(), component);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + component.getToolName());
            }
        }
        this.tools = Collections.unmodifiableMap(byName);
    }

    public Optional<ToolComponent> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    /**
     * Definitions in registration order, as serialized into provider requests.
     */
    public List<ToolDefinition> definitions() {
        List<ToolDefinition> definitions = new ArrayList<>(tools.size());
        for (ToolComponent tool : tools.values()) {
            definitions.add(tool.getDefinition());
        }
        return definitions;
    }

    public Set<String> names() {
        return tools.keySet();
    }

    /**
     * A registry restricted to the given tool names; unknown names are ignored.
     */
    public ToolRegistry subset(Collection<String> names) {
        List<ToolComponent> selected = new ArrayList<>();
        for (String name : names) {
            ToolComponent tool = tools.get(name);
            if (tool != null) {
                selected.add(tool);
            }
        }
        return new ToolRegistry(selected);
    }

    public int size() {
        return tools.size();
    }
}
