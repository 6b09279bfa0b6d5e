package com.chatastro.Payments.config;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.cloud.FirestoreClient;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

/**
 * Initializes Firebase from environment-provided service account fields. Only active when
 * orders and payments are kept in Firestore.
 */
@Configuration
@ConditionalOnProperty(name = "payments.store", havingValue = PaymentProperties.STORE_FIRESTORE)
@Slf4j
public class FirebaseConfig {
    @Value("${firebase.database.url:}")
    private String databaseUrl;
    @Value("${firebase.project.id:}")
    private String projectId;
    @Value("${firebase.private.key.id:}")
    private String privateKeyId;
    @Value("${firebase.private.key:}")
    private String privateKey;
    @Value("${firebase.client.email:}")
    private String clientEmail;
    @Value("${firebase.client.id:}")
    private String clientId;
    @Value("${firebase.client.x509.cert.url:}")
    private String clientX509CertUrl;

    @PostConstruct
    public void init() throws IOException {
        if (!FirebaseApp.getApps().isEmpty()) {
            return;
        }
        if (privateKey == null || privateKey.isEmpty()) {
            throw new IllegalStateException("payments.store=firestore but firebase.private.key is not set");
        }

        // env vars carry the key with escaped newlines
        String pem = privateKey.replace("\\n", "\n");

        Map<String, Object> credentialsMap = new HashMap<>();
        credentialsMap.put("type", "service_account");
        credentialsMap.put("project_id", projectId);
        credentialsMap.put("private_key_id", privateKeyId);
        credentialsMap.put("private_key", pem);
        credentialsMap.put("client_email", clientEmail);
        credentialsMap.put("client_id", clientId);
        credentialsMap.put("auth_uri", "https://accounts.google.com/o/oauth2/auth");
        credentialsMap.put("token_uri", "https://oauth2.googleapis.com/token");
        credentialsMap.put("auth_provider_x509_cert_url", "https://www.googleapis.com/oauth2/v1/certs");
        credentialsMap.put("client_x509_cert_url", clientX509CertUrl);

        GoogleCredentials credentials = GoogleCredentials.fromStream(
                new ByteArrayInputStream(new ObjectMapper().writeValueAsBytes(credentialsMap))
        );

        FirebaseOptions.Builder options = FirebaseOptions.builder()
                .setCredentials(credentials)
                .setProjectId(projectId);
        if (databaseUrl != null && !databaseUrl.isEmpty()) {
            options.setDatabaseUrl(databaseUrl);
        }

        FirebaseApp.initializeApp(options.build());
        log.info("Firebase initialized for project {}", projectId);
    }

    @Bean
    public Firestore firestore() {
        return FirestoreClient.getFirestore();
    }
}
