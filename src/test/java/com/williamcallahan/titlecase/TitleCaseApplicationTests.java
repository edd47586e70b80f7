package com.williamcallahan.titlecase;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.titlecase.cli.TitleCaseCommandLine;
import com.williamcallahan.titlecase.service.casing.TitleCaser;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest(properties = {
        "app.cli.enabled=false"
})
class TitleCaseApplicationTests {

    @Autowired
    private ApplicationContext applicationContext;

    @Autowired
    private TitleCaser titleCaser;

    @Test
    void contextLoadsWithoutCommandLineRunner() {
        assertTrue(applicationContext.getBeansOfType(TitleCaseCommandLine.class).isEmpty());
        assertEquals(
                "Out of the Hurly-Burly; or, Life in an Odd Corner",
                titleCaser.titleCase("out of the hurly-burly; or, life in an odd corner"));
    }

}
