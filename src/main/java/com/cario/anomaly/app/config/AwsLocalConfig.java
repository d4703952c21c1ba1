/**
 * AWS configuration package for the text anomaly service.
 *
 * <p>Contains Spring configuration classes for AWS client beans.
 */
package com.cario.anomaly.app.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.textract.TextractClient;

/**
 * AWS configuration for the local environment.
 *
 * <p>This configuration uses static credentials provided in the application properties for local
 * development and testing purposes. It defines Spring beans for AWS service clients:
 *
 * <ul>
 *   <li>{@link S3Client} - For storing source images and reading generated reports.
 *   <li>{@link S3Presigner} - For minting time-limited report download links.
 *   <li>{@link TextractClient} - For detecting words in stored images.
 *   <li>{@link LambdaClient} - For invoking the document generation function.
 * </ul>
 *
 * <p>Active only when the {@code local} Spring profile is enabled.
 *
 * @author Shaji Nair
 * @version 1.0
 * @since 2025-08-09
 */
@Configuration
@Profile("local")
public class AwsLocalConfig {

  /** AWS region in which the clients will operate. */
  @Value("${aws.region}")
  private String region;

  /** AWS access key ID for local development. */
  @Value("${aws.accessKeyId}")
  private String accessKeyId;

  /** AWS secret access key for local development. */
  @Value("${aws.secretAccessKey}")
  private String secretAccessKey;

  @Bean
  StaticCredentialsProvider awsCreds() {
    return StaticCredentialsProvider.create(
        AwsBasicCredentials.create(accessKeyId, secretAccessKey));
  }

  @Bean
  public S3Client s3Client(StaticCredentialsProvider creds) {
    return S3Client.builder().region(Region.of(region)).credentialsProvider(creds).build();
  }

  @Bean
  S3Presigner s3Presigner(StaticCredentialsProvider creds) {
    return S3Presigner.builder().region(Region.of(region)).credentialsProvider(creds).build();
  }

  @Bean
  public TextractClient textractClient(StaticCredentialsProvider creds) {
    return TextractClient.builder().region(Region.of(region)).credentialsProvider(creds).build();
  }

  @Bean
  public LambdaClient lambdaClient(StaticCredentialsProvider creds) {
    return LambdaClient.builder().region(Region.of(region)).credentialsProvider(creds).build();
  }
}
