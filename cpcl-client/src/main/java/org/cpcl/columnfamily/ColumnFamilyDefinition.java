/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.cpcl.columnfamily;

import org.apache.cassandra.thrift.CfDef;
import org.apache.cassandra.thrift.ColumnDef;
import org.apache.commons.lang3.StringUtils;
import org.cpcl.codec.DataType;
import org.cpcl.exception.CpclInvalidArgumentException;

import java.util.ArrayList;
import java.util.List;

/**
 * Describes a column family to create.
 *
 * <pre>{@code
 * ColumnFamilyDefinition users = ColumnFamilyDefinition.standard("user")
 *     .column(ColumnDefinition.of("name", DataType.UTF8))
 *     .column(ColumnDefinition.indexed("age", DataType.INTEGER))
 *     .build();
 * }</pre>
 */
public final class ColumnFamilyDefinition {

    static final String STANDARD = "Standard";
    static final String SUPER = "Super";

    private final String keyspace;
    private final String name;
    private final boolean superColumnFamily;
    private final DataType comparatorType;
    private final DataType subcomparatorType;
    private final DataType defaultValidationType;
    private final List<ColumnDefinition> columns;
    private final String comment;
    private final Double readRepairChance;
    private final Integer gcGraceSeconds;
    private final Integer minCompactionThreshold;
    private final Integer maxCompactionThreshold;

    private ColumnFamilyDefinition(Builder builder) {
        this.keyspace = builder.keyspace;
        this.name = builder.name;
        this.superColumnFamily = builder.superColumnFamily;
        this.comparatorType = builder.comparatorType;
        this.subcomparatorType = builder.subcomparatorType;
        this.defaultValidationType = builder.defaultValidationType;
        this.columns = List.copyOf(builder.columns);
        this.comment = builder.comment;
        this.readRepairChance = builder.readRepairChance;
        this.gcGraceSeconds = builder.gcGraceSeconds;
        this.minCompactionThreshold = builder.minCompactionThreshold;
        this.maxCompactionThreshold = builder.maxCompactionThreshold;
    }

    public static Builder standard(String name) {
        return new Builder(name, false);
    }

    public static Builder superColumnFamily(String name) {
        return new Builder(name, true);
    }

    public String getKeyspace() {
        return keyspace;
    }

    public String getName() {
        return name;
    }

    public boolean isSuperColumnFamily() {
        return superColumnFamily;
    }

    public List<ColumnDefinition> getColumns() {
        return columns;
    }

    /**
     * Builds the Thrift definition.
     *
     * @param defaultKeyspace the keyspace to use when none was set on the builder
     * @return the definition
     */
    public CfDef toCfDef(String defaultKeyspace) {
        String targetKeyspace = keyspace == null ? defaultKeyspace : keyspace;
        if (StringUtils.isBlank(targetKeyspace)) {
            throw new CpclInvalidArgumentException("No keyspace given for column family \"" + name + "\"");
        }

        CfDef definition = new CfDef(targetKeyspace, name);
        definition.setColumn_type(superColumnFamily ? SUPER : STANDARD);
        definition.setComparator_type(comparatorType.getClassName());
        if (superColumnFamily) {
            definition.setSubcomparator_type(subcomparatorType.getClassName());
        }
        definition.setDefault_validation_class(defaultValidationType.getClassName());

        if (!columns.isEmpty()) {
            DataType columnNameType = superColumnFamily ? subcomparatorType : comparatorType;
            List<ColumnDef> metadata = new ArrayList<>(columns.size());
            for (ColumnDefinition column : columns) {
                metadata.add(column.toColumnDef(columnNameType));
            }
            definition.setColumn_metadata(metadata);
        }
        if (comment != null) {
            definition.setComment(comment);
        }
        if (readRepairChance != null) {
            definition.setRead_repair_chance(readRepairChance);
        }
        if (gcGraceSeconds != null) {
            definition.setGc_grace_seconds(gcGraceSeconds);
        }
        if (minCompactionThreshold != null) {
            definition.setMin_compaction_threshold(minCompactionThreshold);
        }
        if (maxCompactionThreshold != null) {
            definition.setMax_compaction_threshold(maxCompactionThreshold);
        }
        return definition;
    }

    public static final class Builder {
        private final String name;
        private final boolean superColumnFamily;
        private String keyspace;
        private DataType comparatorType = DataType.UTF8;
        private DataType subcomparatorType = DataType.UTF8;
        private DataType defaultValidationType = DataType.UTF8;
        private final List<ColumnDefinition> columns = new ArrayList<>();
        private String comment;
        private Double readRepairChance;
        private Integer gcGraceSeconds;
        private Integer minCompactionThreshold;
        private Integer maxCompactionThreshold;

        private Builder(String name, boolean superColumnFamily) {
            this.name = name;
            this.superColumnFamily = superColumnFamily;
        }

        public Builder keyspace(String keyspace) {
            this.keyspace = keyspace;
            return this;
        }

        public Builder comparatorType(DataType comparatorType) {
            this.comparatorType = comparatorType;
            return this;
        }

        public Builder subcomparatorType(DataType subcomparatorType) {
            this.subcomparatorType = subcomparatorType;
            return this;
        }

        public Builder defaultValidationType(DataType defaultValidationType) {
            this.defaultValidationType = defaultValidationType;
            return this;
        }

        public Builder column(ColumnDefinition column) {
            this.columns.add(column);
            return this;
        }

        public Builder columns(List<ColumnDefinition> columns) {
            this.columns.addAll(columns);
            return this;
        }

        public Builder comment(String comment) {
            this.comment = comment;
            return this;
        }

        public Builder readRepairChance(double readRepairChance) {
            this.readRepairChance = readRepairChance;
            return this;
        }

        public Builder gcGraceSeconds(int gcGraceSeconds) {
            this.gcGraceSeconds = gcGraceSeconds;
            return this;
        }

        public Builder compactionThresholds(int min, int max) {
            this.minCompactionThreshold = min;
            this.maxCompactionThreshold = max;
            return this;
        }

        public ColumnFamilyDefinition build() {
            if (StringUtils.isBlank(name)) {
                throw new CpclInvalidArgumentException("Column family name cannot be null or empty");
            }
            if (comparatorType == null || defaultValidationType == null) {
                throw new CpclInvalidArgumentException("Comparator and default validation types are required");
            }
            if (superColumnFamily && subcomparatorType == null) {
                throw new CpclInvalidArgumentException("A super column family needs a subcomparator type");
            }
            return new ColumnFamilyDefinition(this);
        }
    }
}
