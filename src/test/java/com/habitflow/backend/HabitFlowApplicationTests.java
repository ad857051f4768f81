package com.habitflow.backend;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class HabitFlowApplicationTests {

	@Test
	void contextLoads() {
	}

}
