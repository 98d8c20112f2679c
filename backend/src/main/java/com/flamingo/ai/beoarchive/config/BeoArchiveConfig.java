package com.flamingo.ai.beoarchive.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the BEO archive pipeline. */
@Configuration
@ConfigurationProperties(prefix = "beo")
@Validated
@Getter
@Setter
public class BeoArchiveConfig {

  @Valid private Classification classification = new Classification();
  @Valid private Archive archive = new Archive();
  @Valid private Pipeline pipeline = new Pipeline();
  @Valid private Intake intake = new Intake();
  @Valid private Graph graph = new Graph();
  private Runner runner = new Runner();

  @Getter
  @Setter
  public static class Classification {

    /** Overrides the built-in analyst instructions when set. */
    private String instructions;

    @Min(1)
    private int maxAttempts = 3;

    @NotNull private Duration initialBackoff = Duration.ofSeconds(2);

    @DecimalMin("1.0")
    private double backoffMultiplier = 2.0;

    /** Character budget for the concatenated bundle text sent to the model. */
    @Min(1000)
    private int maxInputChars = 60_000;

    /** Valid verdicts below this confidence are held back for manual review. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minConfidence = 0.5;

    @Min(1)
    private int maxConcurrentCalls = 4;

    @NotNull private Duration maxWaitForPermit = Duration.ofMinutes(5);
  }

  @Getter
  @Setter
  public static class Archive {

    /** Storage backend: "local" or "onedrive". */
    @NotBlank private String backend = "local";

    @Min(1)
    private int maxAttempts = 3;

    @NotNull private Duration initialBackoff = Duration.ofSeconds(1);

    @DecimalMin("1.0")
    private double backoffMultiplier = 2.0;

    @Valid private Local local = new Local();

    @Getter
    @Setter
    public static class Local {
      @NotBlank private String basePath = "./beo_output";
    }
  }

  @Getter
  @Setter
  public static class Pipeline {
    @Min(1)
    private int workerThreads = 4;

    @Min(1)
    private int queueCapacity = 500;
  }

  @Getter
  @Setter
  public static class Intake {

    /** Bundle source: "mailbox" or "directory". */
    @NotBlank private String source = "mailbox";

    @Valid private Mailbox mailbox = new Mailbox();
    @Valid private Directory directory = new Directory();

    @Getter
    @Setter
    public static class Mailbox {
      @NotBlank private String folder = "inbox";

      @Min(1)
      private int pageSize = 50;

      @Min(1)
      private int maxMessages = 200;
    }

    @Getter
    @Setter
    public static class Directory {
      private String path = "./beo_inbox";
    }
  }

  /** Microsoft Graph access shared by the mailbox reader and the OneDrive archive. */
  @Getter
  @Setter
  public static class Graph {
    @NotBlank private String baseUrl = "https://graph.microsoft.com/v1.0";

    /** Already-valid bearer token; acquisition and refresh happen outside this service. */
    private String accessToken;

    @NotNull private Duration timeout = Duration.ofSeconds(60);
    @NotNull private Duration uploadTimeout = Duration.ofSeconds(120);
  }

  @Getter
  @Setter
  public static class Runner {
    private boolean enabled = false;
  }
}
