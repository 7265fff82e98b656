package io.nosqlbench.rangeserver.range;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
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

import java.util.Objects;

/// The outcome of interpreting a `Range` header against a file size.
///
/// Exactly one of three states: no header was sent, the header resolved to a
/// satisfiable [ByteRange], or the header was malformed or unsatisfiable.
/// A malformed header is a distinct state from an absent one.
///
/// @param outcome which of the three states this is
/// @param range   the resolved range, present only for [Outcome#SATISFIABLE]
/// @param reason  why the header was rejected, present only for [Outcome#INVALID]
public record RangeParseResult(Outcome outcome, ByteRange range, String reason) {

    /// The three possible states of a parsed `Range` header.
    public enum Outcome {
        /// No `Range` header was sent.
        NO_RANGE,
        /// The header resolved to a range within the file.
        SATISFIABLE,
        /// The header could not be parsed, or its range lies outside the file.
        INVALID
    }

    private static final RangeParseResult NO_RANGE = new RangeParseResult(Outcome.NO_RANGE, null, null);

    public RangeParseResult {
        Objects.requireNonNull(outcome, "outcome");
        if ((outcome == Outcome.SATISFIABLE) != (range != null)) {
            throw new IllegalArgumentException("A range is required for, and only for, a satisfiable outcome");
        }
    }

    /// @return the shared result for a request without a `Range` header
    public static RangeParseResult noRange() {
        return NO_RANGE;
    }

    /// @param range the resolved range
    /// @return a satisfiable result
    public static RangeParseResult satisfiable(ByteRange range) {
        return new RangeParseResult(Outcome.SATISFIABLE, Objects.requireNonNull(range, "range"), null);
    }

    /// @param reason a short description used for diagnostics
    /// @return an invalid result
    public static RangeParseResult invalid(String reason) {
        return new RangeParseResult(Outcome.INVALID, null, reason);
    }

    public boolean isSatisfiable() {
        return outcome == Outcome.SATISFIABLE;
    }

    public boolean isInvalid() {
        return outcome == Outcome.INVALID;
    }

    @Override
    public String toString() {
        switch (outcome) {
            case SATISFIABLE:
                return "satisfiable " + range;
            case INVALID:
                return "invalid (" + reason + ")";
            default:
                return "no range";
        }
    }
}
