package com.foodgram.recipe_service;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class FoodgramApplicationTests {

	@Test
	void contextLoads() {
	}

}
