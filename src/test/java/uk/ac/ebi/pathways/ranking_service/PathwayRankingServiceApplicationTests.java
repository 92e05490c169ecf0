package uk.ac.ebi.pathways.ranking_service;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class PathwayRankingServiceApplicationTests {

  @Test
  void contextLoads() {}
}
