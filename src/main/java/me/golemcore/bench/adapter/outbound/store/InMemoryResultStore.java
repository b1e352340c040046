package me.golemcore.bench.adapter.outbound.store;

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

import me.golemcore.bench.domain.model.RunKey;
import me.golemcore.bench.domain.model.RunRecord;
import me.golemcore.bench.port.outbound.ResultStorePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps run records for the lifetime of the process. A second record for the
 * same (model, case) replaces the first but keeps its original position.
 */
@Component
public class InMemoryResultStore implements ResultStorePort {

    private final Map<RunKey, RunRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized void save(RunRecord record) {
        records.put(record.key(), record);
    }

    @Override
    public synchronized Optional<RunRecord> find(RunKey key) {
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public synchronized List<RunRecord> findAll() {
        return new ArrayList<>(records.values());
    }
}
