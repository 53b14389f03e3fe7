package dao.gaszero.relayer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class GasZeroRelayerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GasZeroRelayerApplication.class, args);
    }
}
