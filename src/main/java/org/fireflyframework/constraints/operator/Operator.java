/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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
 */

package org.fireflyframework.constraints.operator;

import org.fireflyframework.constraints.exception.ConstraintFormatException;
import org.fireflyframework.constraints.proto.Op;

/**
 * Closed set of comparison kinds a constraint can apply.
 *
 * <ul>
 *   <li>{@link #LT}, {@link #LE}, {@link #EQ}, {@link #NE}, {@link #GE}, {@link #GT} - ordering
 *       comparisons against a literal or another summary field</li>
 *   <li>{@link #MATCH}, {@link #NOMATCH} - prefix match of text against a regular expression</li>
 *   <li>{@link #BETWEEN} - inclusive range check of a summary field</li>
 *   <li>{@link #IN_SET}, {@link #CONTAIN_SET}, {@link #EQ_SET} - approximate subset, superset and
 *       equality between observed distinct values and a reference set</li>
 * </ul>
 */
public enum Operator {

    LT(Op.LT),
    LE(Op.LE),
    EQ(Op.EQ),
    NE(Op.NE),
    GE(Op.GE),
    GT(Op.GT),
    MATCH(Op.MATCH),
    NOMATCH(Op.NOMATCH),
    BETWEEN(Op.BTWN),
    IN_SET(Op.IN_SET),
    CONTAIN_SET(Op.CONTAIN_SET),
    EQ_SET(Op.EQ_SET);

    private final Op wire;

    Operator(Op wire) {
        this.wire = wire;
    }

    public boolean isPattern() {
        return this == MATCH || this == NOMATCH;
    }

    public boolean isSetRelation() {
        return this == IN_SET || this == CONTAIN_SET || this == EQ_SET;
    }

    public Op toProto() {
        return wire;
    }

    /**
     * Resolves the wire operator code.
     *
     * @param op the wire code
     * @return the matching operator
     * @throws ConstraintFormatException if the code is unspecified or unknown
     */
    public static Operator fromProto(Op op) {
        if (op != null) {
            for (Operator operator : values()) {
                if (operator.wire == op) {
                    return operator;
                }
            }
        }
        throw new ConstraintFormatException("Unknown constraint operator code: " + op);
    }
}
