/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.datacleaner.detection.text;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.detection.Detectors;
import com.amazon.datacleaner.detection.IDetector;
import com.amazon.datacleaner.detection.IncompatibleDataException;
import com.amazon.datacleaner.frame.Column;
import com.amazon.datacleaner.returntypes.ErrorMask;

public class EmailDetectorTest {

    @Test
    public void testEmails() {
        Column emails = Column.of("email", "toto@caramail.com", "toto@caramail.com_", "to?to@caramail.com",
                "to.to@caramail.com", "to,to@caramail.com", "to,to@cara-mail.com", "jAime_589_Les_Frites@yahoo.com",
                "toto@caramail.co-m", "to|to@caramail.com", "jaime_589_les-frites@yahoo.com", "roger", "gerard@",
                "blabla@gmail");
        ErrorMask mask = EmailDetector.fromData(emails).isError();
        boolean[] expected = { false, true, true, false, true, true, false, true, true, false, true, true, true };
        for (int i = 0; i < expected.length; i++) {
            assertEquals(expected[i], mask.get(i), "row " + i);
        }
    }

    @Test
    public void testEmptyValues() {
        Column emails = Column.of("email", null, "toto@caramail.com", "", null);
        EmailDetector detector = EmailDetector.fromData(emails);
        assertThat(detector.getIndex(), contains(2));
        assertArrayEquals(new boolean[] { false, false, true, false }, detector.isError().values);
    }

    @Test
    public void testNumericColumn() {
        IncompatibleDataException e = assertThrows(IncompatibleDataException.class,
                () -> EmailDetector.fromData(Column.numeric("x", 1, 2)));
        assertEquals("This detector applies to categorical/string columns.", e.getMessage());
    }

    @Test
    public void testOnlyMissingValues() {
        IDetector<Column> detector = Detectors.fromData(DetectorKind.EMAIL, null, Column.of("mail", null, null));
        assertThat(detector.getIndex(), empty());
        assertFalse(detector.hasErrors());
    }
}
