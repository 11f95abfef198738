package com.hypmag.model;

import com.hypmag.exception.ColumnNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CatalogueTest {

    @Test
    void columnsKeepInsertionOrder() {
        Catalogue catalogue = new Catalogue()
                .addColumn("b", new double[]{1, 2})
                .addColumn("a", new float[]{1, 2})
                .addColumn("c", new String[]{"x", "y"});

        assertEquals(List.of("b", "a", "c"), catalogue.columnNames());
        assertEquals(2, catalogue.size());
    }

    @Test
    void emptyCatalogueHasNoRows() {
        assertEquals(0, new Catalogue().size());
    }

    @Test
    void columnsMustHaveEqualLength() {
        Catalogue catalogue = new Catalogue().addColumn("a", new double[]{1, 2, 3});

        assertThrows(IllegalArgumentException.class, () -> catalogue.addColumn("b", new double[]{1}));
    }

    @Test
    void replacingAColumnKeepsItsPosition() {
        Catalogue catalogue = new Catalogue()
                .addColumn("a", new double[]{1, 2})
                .addColumn("b", new double[]{3, 4})
                .addColumn("a", new float[]{5, 6});

        assertEquals(List.of("a", "b"), catalogue.columnNames());
        assertArrayEquals(new double[]{5, 6}, catalogue.getDoubles("a"));
    }

    @Test
    void floatColumnsAreWidened() {
        Catalogue catalogue = new Catalogue().addColumn("m", new float[]{25.5f, -99.0f});

        assertArrayEquals(new double[]{25.5, -99.0}, catalogue.getDoubles("m"));
    }

    @Test
    void textColumnIsNotNumeric() {
        Catalogue catalogue = new Catalogue().addColumn("t", new String[]{"x"});

        assertThrows(IllegalArgumentException.class, () -> catalogue.getDoubles("t"));
    }

    @Test
    void missingColumn() {
        ColumnNotFoundException e = assertThrows(ColumnNotFoundException.class,
                () -> new Catalogue().getDoubles("FLUX"));
        assertEquals("FLUX", e.getColumn());
    }

    @Test
    void labelsOfNumericAndTextColumns() {
        Catalogue catalogue = new Catalogue()
                .addColumn("n", new double[]{12.0, 3.5, -0.0})
                .addColumn("t", new String[]{" KIDS_1 ", "7.0", null});

        assertArrayEquals(new String[]{"12", "3.5", "0"}, catalogue.getLabels("n"));
        assertArrayEquals(new String[]{"KIDS_1", "7", ""}, catalogue.getLabels("t"));
    }
}
