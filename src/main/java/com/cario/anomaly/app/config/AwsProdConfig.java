/**
 * AWS configuration package for the text anomaly service.
 *
 * <p>Contains Spring configuration classes that provide AWS client beans for S3, Textract and
 * Lambda.
 */
package com.cario.anomaly.app.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.textract.TextractClient;

/**
 * AWS configuration for the production profile.
 *
 * <p>Clients resolve credentials through the SDK default chain (environment, instance profile or
 * task role), so no secrets are read from application properties.
 *
 * <p>This configuration is active only when the {@code production} Spring profile is enabled.
 *
 * @author Shaji Nair
 * @version 1.0
 * @since 2025-08-09
 */
@Configuration
@Profile("production")
public class AwsProdConfig {

  /**
   * AWS region in which the clients will operate. Injected from the application configuration
   * property {@code aws.region}.
   */
  @Value("${aws.region}")
  private String region;

  @Bean
  public S3Client s3Client() {
    return S3Client.builder()
        .region(Region.of(region))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .build();
  }

  @Bean
  S3Presigner s3Presigner() {
    return S3Presigner.builder()
        .region(Region.of(region))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .build();
  }

  @Bean
  public TextractClient textractClient() {
    return TextractClient.builder().region(Region.of(region)).build();
  }

  /**
   * Creates the Lambda client used to call the document generation function synchronously.
   *
   * @return a configured {@link LambdaClient} for the specified AWS region.
   */
  @Bean
  public LambdaClient lambdaClient() {
    return LambdaClient.builder().region(Region.of(region)).build();
  }
}
