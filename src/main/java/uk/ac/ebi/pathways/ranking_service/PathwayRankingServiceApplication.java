package uk.ac.ebi.pathways.ranking_service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PathwayRankingServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(PathwayRankingServiceApplication.class, args);
  }
}
