package com.phillippitts.mathscrap;

import com.phillippitts.mathscrap.config.ocr.EasyOcrConfig;
import com.phillippitts.mathscrap.config.ocr.PaddleOcrConfig;
import com.phillippitts.mathscrap.config.ocr.Pix2TexConfig;
import com.phillippitts.mathscrap.config.ocr.TesseractConfig;
import com.phillippitts.mathscrap.config.properties.CascadeProperties;
import com.phillippitts.mathscrap.config.properties.ImageValidationProperties;
import com.phillippitts.mathscrap.config.properties.ReadableProperties;
import com.phillippitts.mathscrap.config.properties.TranslatorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        Pix2TexConfig.class,
        EasyOcrConfig.class,
        PaddleOcrConfig.class,
        TesseractConfig.class,
        CascadeProperties.class,
        TranslatorProperties.class,
        ReadableProperties.class,
        ImageValidationProperties.class
})
public class MathScrapApplication {

    public static void main(String[] args) {
        SpringApplication.run(MathScrapApplication.class, args);
    }

}
