package ru.nsu.fanout.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Один результат от worker-а: имя исходного файла и base64-нагрузка.
 * Любое из полей может отсутствовать в ответе, поэтому оба nullable.
 */
@Getter
@AllArgsConstructor
public class ProcessedItem {
    private final String filename;
    private final String payload;
}
