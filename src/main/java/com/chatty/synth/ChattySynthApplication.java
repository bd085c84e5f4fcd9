package com.chatty.synth;

import com.chatty.synth.config.properties.BackendProperties;
import com.chatty.synth.config.properties.DispatchProperties;
import com.chatty.synth.config.properties.FallbackProperties;
import com.chatty.synth.config.properties.SeatProperties;
import com.chatty.synth.config.properties.ThreadPoolProperties;
import com.chatty.synth.config.properties.TimeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        BackendProperties.class,
        DispatchProperties.class,
        FallbackProperties.class,
        SeatProperties.class,
        ThreadPoolProperties.class,
        TimeProperties.class
})
public class ChattySynthApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChattySynthApplication.class, args);
    }

}
