package github.sarthakdev143.photo_framer.config;

import github.sarthakdev143.photo_framer.processor.LogoRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class PhotoFramerConfiguration {

    @Bean(name = "batchCoordinatorExecutor")
    public ThreadPoolTaskExecutor batchCoordinatorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(16);
        executor.setThreadNamePrefix("batch-coordinator-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean
    public LogoRepository logoRepository(PhotoFramerProperties properties) {
        return LogoRepository.load(properties.getLogoDir());
    }
}
