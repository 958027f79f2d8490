package ru.nsu.fanout.worker;

import lombok.extern.slf4j.Slf4j;
import ru.nsu.fanout.model.FileBlob;
import ru.nsu.fanout.model.ProcessedItem;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Обрабатывает файлы запроса в пуле потоков.
 * Результаты возвращаются в порядке файлов; файлы с ошибкой пропускаются.
 */
@Slf4j
public class FileTaskExecutor {
    private final ExecutorService executorService;
    private final AtomicInteger activeFiles = new AtomicInteger();

    public FileTaskExecutor(int threadPoolSize) {
        this.executorService = Executors.newFixedThreadPool(threadPoolSize);
    }

    public List<ProcessedItem> processAll(List<FileBlob> files, ContentProcessor processor) throws InterruptedException {
        List<Future<ProcessedItem>> futures = new ArrayList<>(files.size());
        for (FileBlob file : files) {
            futures.add(executorService.submit(() -> processOne(file, processor)));
        }

        List<ProcessedItem> results = new ArrayList<>(files.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                log.error("Failed to process {}", files.get(i).getFilename(), e.getCause());
            }
        }
        return results;
    }

    private ProcessedItem processOne(FileBlob file, ContentProcessor processor) throws Exception {
        activeFiles.incrementAndGet();
        try {
            log.debug("Processing {}", file);
            byte[] output = processor.process(file);
            return new ProcessedItem(file.getFilename(), Base64.getEncoder().encodeToString(output));
        } finally {
            activeFiles.decrementAndGet();
        }
    }

    public int getActiveFiles() {
        return activeFiles.get();
    }

    public void shutdown() {
        executorService.shutdown();
    }
}
