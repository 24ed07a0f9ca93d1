package metahub.addon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MetahubCacheApplication {

  public static void main(String[] args) {
    SpringApplication.run(MetahubCacheApplication.class, args);
  }
}
