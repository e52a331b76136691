package com.tcecnotifier.infrastructure.config;

import com.tcecnotifier.infrastructure.persistence.FileSeenGameRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Notifier configuration.
 */
@Configuration
public class TcecConfig {

    @Value("${tcec.pgn-url:https://tcec-chess.com/live.pgn}")
    private String pgnUrl;

    @Value("${tcec.site-url:https://tcec-chess.com/}")
    private String siteUrl;

    @Value("${tcec.config-url}")
    private String configUrl;

    @Value("${tcec.notify-webhook}")
    private String notifyWebhook;

    @Value("${tcec.log-webhook:}")
    private String logWebhook;

    @Value("${tcec.state-file:state.bin}")
    private String stateFile;

    @Bean
    public TcecProperties tcecProperties() {
        return new TcecProperties(pgnUrl, siteUrl, configUrl, notifyWebhook, logWebhook);
    }

    /**
     * The seen-games store. A state file that cannot be loaded stops start-up.
     */
    @Bean
    public FileSeenGameRepository seenGameRepository() throws IOException {
        return FileSeenGameRepository.load(Path.of(stateFile));
    }
}
