package org.waabox.puckline.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Spring Boot application entry point for the Puckline hockey service.
 *
 * <p>The {@link org.waabox.puckline.Puckline} instance comes from the
 * starter's auto-configuration and is bound to the {@code puckline.*}
 * properties in {@code application.yml}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@SpringBootApplication
public class PucklineApplication {

  /** Launches the Spring Boot application.
   *
   * @param args the command-line arguments
   */
  public static void main(final String[] args) {
    SpringApplication.run(PucklineApplication.class, args);
  }
}
