package com.titiplex.tracker;

import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpringConfig {
}
