package fun.fengwk.c2md.cli.convert;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author fengwk
 */
@SpringBootApplication(scanBasePackages = "fun.fengwk.c2md")
public class CliConvertApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CliConvertApplication.class, args)));
    }

}
