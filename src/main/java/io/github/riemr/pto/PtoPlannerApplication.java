package io.github.riemr.pto;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@MapperScan("io.github.riemr.pto.infrastructure.mapper")
public class PtoPlannerApplication {

	public static void main(String[] args) {
		SpringApplication.run(PtoPlannerApplication.class, args);
	}

}
