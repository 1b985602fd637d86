package com.spreadsheet.engine;

import com.spreadsheet.engine.config.SheetProperties;
import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.services.AutofillService;
import com.spreadsheet.engine.services.HistoryService;
import com.spreadsheet.engine.services.SheetService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Starts the application context with the test profile and checks the wiring.
 */
@SpringBootTest(classes = AppApplication.class)
@ActiveProfiles("test")
class AppApplicationTests {

    @Autowired
    SheetProperties properties;

    @Autowired
    SheetService sheetService;

    @Autowired
    HistoryService historyService;

    @Autowired
    AutofillService autofillService;

    @Test
    void testPropertiesBound() {
        assertEquals(10, properties.getRows());
        assertEquals(10, properties.getColumns());
        assertEquals(3, properties.getHistorySize());
        assertEquals(10, sheetService.getRows());
        assertEquals(10, sheetService.getColumns());
    }

    @Test
    void testServicesShareOneSheet() {
        historyService.checkpoint();
        sheetService.setCell("J1", "=J2+1");
        assertEquals(CellValue.of(1), sheetService.getCell("J1").getValue());

        assertTrue(historyService.undo());
        assertEquals("", sheetService.getCell("J1").getText());
        assertNotNull(autofillService);
    }
}
