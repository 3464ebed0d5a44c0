package github.sarthakdev143.hdr_studio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HdrStudioApplication {

	public static void main(String[] args) {
		SpringApplication.run(HdrStudioApplication.class, args);
	}

}
