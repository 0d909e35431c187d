package com.kpAnalyzer.financeEngine;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * Verifies that the application context loads with the bundled pattern resource.
 */
@SpringBootTest
class FinanceEngineApplicationTests {

    @Test
    void contextLoads() {
    }
}
