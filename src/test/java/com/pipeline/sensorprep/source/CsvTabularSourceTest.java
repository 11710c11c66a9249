package com.pipeline.sensorprep.source;

import com.pipeline.sensorprep.exception.DataSourceException;
import com.pipeline.sensorprep.exception.SchemaException;
import com.pipeline.sensorprep.model.TabularDataset;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;

import static com.pipeline.sensorprep.TestDatasets.values;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class CsvTabularSourceTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private CsvTabularSource write(String content) throws IOException {
        File file = folder.newFile("data.csv");
        Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
        return new CsvTabularSource(file.toPath());
    }

    @Test
    public void testInfersColumnTypes() throws IOException {
        CsvTabularSource source = write("time,count,level,flag,state\n"
                + "2025-01-01 00:00:00,1,1.5,true,on\n"
                + "2025-01-01 01:00:00,2,,False,off\n");

        TabularDataset data = source.read(Arrays.asList("count", "level", "flag", "state"));

        assertEquals(values(1L, 2L), data.getColumn("count"));
        assertEquals(values(1.5, null), data.getColumn("level"));
        assertEquals(values(true, false), data.getColumn("flag"));
        assertEquals(values("on", "off"), data.getColumn("state"));
    }

    @Test
    public void testIntegerColumnWithGapsIsWidened() throws IOException {
        CsvTabularSource source = write("a\n1\nNA\n3\n");

        assertEquals(values(1.0, null, 3.0), source.read(Collections.singletonList("a")).getColumn("a"));
    }

    @Test
    public void testSkipAndLimitIgnoreBlankLines() throws IOException {
        CsvTabularSource source = write("a,b\n1,x\n\n2,y\n3,z\n4,w\n");

        TabularDataset data = source.read(Collections.singletonList("b"), 1, 2);

        assertEquals(2, data.getRowCount());
        assertEquals(values("y", "z"), data.getColumn("b"));
    }

    @Test
    public void testQuotedFieldsAndBom() throws IOException {
        CsvTabularSource source = write("\uFEFFname,note\n\"Smith, J\",\"say \"\"hi\"\"\"\n");

        TabularDataset data = source.read(Arrays.asList("name", "note"));
        assertEquals(values("Smith, J"), data.getColumn("name"));
        assertEquals(values("say \"hi\""), data.getColumn("note"));
    }

    @Test
    public void testQuoteInsideUnquotedFieldIsLiteral() throws IOException {
        CsvTabularSource source = write("time,note,level\n"
                + "2025-01-01 00:00:00,12\" pipe,1\n"
                + "2025-01-01 01:00:00,ok,2\n"
                + "2025-01-01 02:00:00,,3\n");

        TabularDataset data = source.read(Arrays.asList("time", "note", "level"));

        assertEquals(3, data.getRowCount());
        assertEquals(values("12\" pipe", "ok", null), data.getColumn("note"));
        assertEquals(values(1L, 2L, 3L), data.getColumn("level"));
    }

    @Test
    public void testUnknownColumnListsAvailable() throws IOException {
        CsvTabularSource source = write("a,b\n1,2\n");

        SchemaException e = assertThrows(SchemaException.class, () -> source.read(Collections.singletonList("c")));
        assertTrue(e.getMessage().contains("available columns: [a, b]"));
    }

    @Test
    public void testEmptyFileRejected() throws IOException {
        CsvTabularSource source = write("");

        assertThrows(SchemaException.class, () -> source.read(Collections.singletonList("a")));
    }

    @Test
    public void testMissingFileWrapped() {
        CsvTabularSource source = new CsvTabularSource(folder.getRoot().toPath().resolve("absent.csv"));

        assertThrows(DataSourceException.class, () -> source.read(Collections.singletonList("a")));
    }
}
