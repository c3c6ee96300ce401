package eu.virtualparadox.lobbymap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LobbyMapApplication {

    public static void main(final String[] args) {
        SpringApplication.run(LobbyMapApplication.class, args);
    }
}
