package com.phillippitts.peercall;

import com.phillippitts.peercall.config.properties.CallProperties;
import com.phillippitts.peercall.config.properties.IdentityProperties;
import com.phillippitts.peercall.config.properties.SignalingProperties;
import com.phillippitts.peercall.config.properties.StoreProperties;
import com.phillippitts.peercall.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        SignalingProperties.class,
        CallProperties.class,
        IdentityProperties.class,
        StoreProperties.class,
        ThreadPoolProperties.class
})
public class PeerCallApplication {

    public static void main(String[] args) {
        SpringApplication.run(PeerCallApplication.class, args);
    }

}
