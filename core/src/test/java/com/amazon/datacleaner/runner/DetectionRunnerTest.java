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

package com.amazon.datacleaner.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.datacleaner.frame.DataType;
import com.amazon.datacleaner.frame.Table;

public class DetectionRunnerTest {

    private DetectionRunner runner;

    private BufferedReader in;
    private PrintWriter out;

    @BeforeEach
    public void setUp() {
        runner = new DetectionRunner();
        in = mock(BufferedReader.class);
        out = mock(PrintWriter.class);
    }

    @Test
    public void testRunIqr() throws IOException {
        runner.parse("--method", "iqr", "--threshold", "2");
        when(in.readLine()).thenReturn("x", "0", "100", "-1", "1", "-6", "6", "0", "1", "-1", "0", null);
        runner.run(in, out);
        verify(out).println("x,is_error");
        verify(out).println("100,true");
        verify(out).println("-6,true");
        verify(out).println("6,true");
        verify(out, times(3)).println("0,false");
        verify(out, times(2)).println("1,false");
        verify(out, times(2)).println("-1,false");
        verify(out).flush();
    }

    @Test
    public void testRunOnSelectedColumn() throws IOException {
        runner.parse("-m", "bounded", "-c", "v", "--lower", "0", "--upper", "10", "-d", ";");
        when(in.readLine()).thenReturn("name;v", "a;5", "b;", "c;11", "d;-1", null);
        runner.run(in, out);
        verify(out).println("name;v;is_error");
        verify(out).println("a;5;false");
        verify(out).println("b;;false");
        verify(out).println("c;11;true");
        verify(out).println("d;-1;true");
    }

    @Test
    public void testRunTextMethod() throws IOException {
        runner.parse("-m", "email", "-c", "mail");
        when(in.readLine()).thenReturn("id,mail", "1,toto@caramail.com", "2,roger", "3,", null);
        runner.run(in, out);
        verify(out).println("1,toto@caramail.com,false");
        verify(out).println("2,roger,true");
        verify(out).println("3,,false");
    }

    @Test
    public void testRunOutliersOnNumericColumns() throws IOException {
        runner.parse("-m", "outliers");
        when(in.readLine()).thenReturn("label,x,y", "a,10,7.46", "b,8,6.77", "c,13,12.74", "d,9,7.11", "e,11,7.81",
                "f,14,8.84", "g,6,6.08", "h,4,5.39", "i,12,8.15", "j,7,6.42", "k,5,5.73", null);
        runner.run(in, out);
        verify(out).println("label,x,y,is_error");
        verify(out).println("c,13,12.74,true");
        verify(out).println("a,10,7.46,false");
        verify(out).println("k,5,5.73,false");
    }

    @Test
    public void testRunByCategory() throws IOException {
        runner.parse("-m", "iqr", "-c", "height,group");
        when(in.readLine()).thenReturn("height,group", "0,I", "0,I", "0,I", "0,I", "-1,I", "1,I", "-1,I", "1,I",
                "-2,I", "2,I", "5,I", "6,II", "6,II", "6,II", "6,II", "5,II", "7,II", "5,II", "7,II", "4,II", "8,II",
                null);
        runner.run(in, out);
        verify(out).println("5,I,true");
        verify(out, times(2)).println("5,II,false");
        verify(out).println("8,II,false");
    }

    @Test
    public void testEmptyInput() throws IOException {
        when(in.readLine()).thenReturn(null);
        runner.run(in, out);
        verify(out, never()).println(anyString());
        verify(out).flush();
    }

    @Test
    public void testWrongNumberOfValues() throws IOException {
        when(in.readLine()).thenReturn("a,b", "1,2", "3", null);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> runner.run(in, out));
        assertEquals("Wrong number of values on line 3. Expected 2 but found 1.", e.getMessage());
    }

    @Test
    public void testReadTable() {
        Table table = DetectionRunner.readTable(new String[] { "n", "s" },
                Arrays.asList(new String[] { "1.5", "a" }, new String[] { " ", "2" }, new String[] { "-3", "" }));
        assertEquals(DataType.NUMERIC, table.getColumn("n").getDtype());
        assertEquals(Arrays.asList(1.5, null, -3.0), table.getColumn("n").getValues());
        assertEquals(DataType.OBJECT, table.getColumn("s").getDtype());
        assertEquals(Arrays.asList("a", "2", null), table.getColumn("s").getValues());
    }
}
