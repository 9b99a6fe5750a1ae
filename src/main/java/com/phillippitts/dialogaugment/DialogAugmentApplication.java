package com.phillippitts.dialogaugment;

import com.phillippitts.dialogaugment.config.properties.IdentityProperties;
import com.phillippitts.dialogaugment.config.properties.PipelineProperties;
import com.phillippitts.dialogaugment.config.properties.RetryProperties;
import com.phillippitts.dialogaugment.config.properties.ThreadPoolProperties;
import com.phillippitts.dialogaugment.config.transform.AsrNoiseProperties;
import com.phillippitts.dialogaugment.config.transform.SynthesisConfig;
import com.phillippitts.dialogaugment.config.transform.TranslationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        PipelineProperties.class,
        RetryProperties.class,
        IdentityProperties.class,
        ThreadPoolProperties.class,
        SynthesisConfig.class,
        TranslationProperties.class,
        AsrNoiseProperties.class
})
public class DialogAugmentApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(DialogAugmentApplication.class, args)));
    }

}
