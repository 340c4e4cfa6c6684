package github.sarthakdev143.photo_framer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PhotoFramerApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(PhotoFramerApplication.class, args)));
	}

}
