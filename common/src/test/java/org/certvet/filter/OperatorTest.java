/*
 * Copyright (C) 2025 The Certvet Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.certvet.filter;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class OperatorTest {
    @Test
    public void fromSymbol() {
        for (Operator op : Operator.values()) {
            assertEquals(op, Operator.fromSymbol(op.symbol()));
        }
        assertNull(Operator.fromSymbol("=="));
        assertNull(Operator.fromSymbol("!="));
    }

    @Test
    public void numericComparisons() {
        assertTrue(Operator.EQUAL.evaluate(false, false, 0));
        assertFalse(Operator.EQUAL.evaluate(false, false, 1));
        assertTrue(Operator.GREATER.evaluate(false, false, 1));
        assertFalse(Operator.GREATER.evaluate(false, false, 0));
        assertTrue(Operator.LESS.evaluate(false, false, -1));
        assertFalse(Operator.LESS.evaluate(false, false, 0));
        assertTrue(Operator.GREATER_EQUAL.evaluate(false, false, 0));
        assertFalse(Operator.GREATER_EQUAL.evaluate(false, false, -1));
        assertTrue(Operator.LESS_EQUAL.evaluate(false, false, 0));
        assertFalse(Operator.LESS_EQUAL.evaluate(false, false, 1));
    }

    @Test
    public void currentStoreAgainstNumericConstraint() {
        // The numeric comparison result is ignored once either side is current.
        for (int cmp = -1; cmp <= 1; cmp++) {
            assertFalse(Operator.EQUAL.evaluate(true, false, cmp));
            assertTrue(Operator.GREATER.evaluate(true, false, cmp));
            assertFalse(Operator.LESS.evaluate(true, false, cmp));
            assertTrue(Operator.GREATER_EQUAL.evaluate(true, false, cmp));
            assertFalse(Operator.LESS_EQUAL.evaluate(true, false, cmp));
        }
    }

    @Test
    public void currentConstraint() {
        assertTrue(Operator.EQUAL.evaluate(true, true, 0));
        assertFalse(Operator.EQUAL.evaluate(false, true, 0));
        assertTrue(Operator.GREATER_EQUAL.evaluate(true, true, 0));
        assertFalse(Operator.GREATER_EQUAL.evaluate(false, true, 0));
        assertFalse(Operator.GREATER.evaluate(true, true, 0));
        assertFalse(Operator.GREATER.evaluate(false, true, 0));
        assertFalse(Operator.LESS.evaluate(true, true, 0));
        assertTrue(Operator.LESS.evaluate(false, true, 0));
        assertTrue(Operator.LESS_EQUAL.evaluate(true, true, 0));
        assertTrue(Operator.LESS_EQUAL.evaluate(false, true, 0));
    }
}
