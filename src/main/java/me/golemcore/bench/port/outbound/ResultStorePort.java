package me.golemcore.bench.port.outbound;

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

import java.util.List;
import java.util.Optional;

/**
 * Results store shared by concurrent runs. Writes are partitioned by
 * {@link RunKey}, so implementations only need per-key atomicity.
 */
public interface ResultStorePort {

    void save(RunRecord record);

    Optional<RunRecord> find(RunKey key);

    /** All records in insertion order. */
    List<RunRecord> findAll();
}
