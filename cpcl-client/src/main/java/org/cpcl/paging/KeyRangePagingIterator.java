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

package org.cpcl.paging;

import org.apache.cassandra.thrift.ColumnParent;
import org.apache.cassandra.thrift.ConsistencyLevel;
import org.apache.cassandra.thrift.KeyRange;
import org.apache.cassandra.thrift.KeySlice;
import org.apache.cassandra.thrift.SlicePredicate;
import org.cpcl.connection.Operations;
import org.cpcl.dispatch.CallDispatcher;
import org.cpcl.model.KeyedRow;
import org.cpcl.model.RowDecoder;
import org.cpcl.model.RowKeys;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * Pages through the rows of a key range. An empty end key leaves the range open.
 */
public class KeyRangePagingIterator extends PagingIterator {

    private final CallDispatcher dispatcher;
    private final ColumnParent columnParent;
    private final SlicePredicate predicate;
    private final String endKey;
    private final ConsistencyLevel consistency;
    private final RowDecoder decoder;

    public KeyRangePagingIterator(
            CallDispatcher dispatcher,
            ColumnParent columnParent,
            SlicePredicate predicate,
            String startKey,
            String endKey,
            ConsistencyLevel consistency,
            RowDecoder decoder,
            int pageSize,
            Integer rowCountLimit) {
        super(startKey, pageSize, rowCountLimit);
        this.dispatcher = dispatcher;
        this.columnParent = columnParent;
        this.predicate = predicate;
        this.endKey = endKey == null ? "" : endKey;
        this.consistency = consistency;
        this.decoder = decoder;
    }

    @Override
    protected List<KeyedRow> fetchPage(ByteBuffer startKey, int count) {
        KeyRange range = new KeyRange(count);
        range.setStart_key(startKey);
        range.setEnd_key(RowKeys.encode(endKey));
        List<KeySlice> slices =
                dispatcher.call(Operations.GET_RANGE_SLICES, columnParent, predicate, range, consistency);
        return decoder.decodeKeySlices(slices, columnParent.isSetSuper_column());
    }

    public String getEndKey() {
        return endKey;
    }
}
