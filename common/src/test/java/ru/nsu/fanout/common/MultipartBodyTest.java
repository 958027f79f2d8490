package ru.nsu.fanout.common;

import org.junit.jupiter.api.Test;
import ru.nsu.fanout.model.FileBlob;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class MultipartBodyTest {

    @Test
    void writesPartsThatTheParserUnderstands() throws Exception {
        byte[] png = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n'};
        MultipartBody body = new MultipartBody("test-boundary")
                .addField("task_type", "image")
                .addFile("images", new FileBlob("one.png", png, "image/png"))
                .addFile("images", new FileBlob("two.png", new byte[]{1}, "image/png"));

        assertThat(body.contentType()).isEqualTo("multipart/form-data; boundary=test-boundary");

        MultipartForm form = MultipartParser.parse(body.contentType(), body.toByteArray());
        assertThat(form.getField("task_type")).contains("image");
        assertThat(form.getFiles("images"))
                .extracting(FileBlob::getFilename)
                .containsExactly("one.png", "two.png");
        assertThat(form.getFiles("images").get(0).getContent()).isEqualTo(png);
    }

    @Test
    void escapesQuotesInFilenames() {
        MultipartBody body = new MultipartBody("b")
                .addFile("texts", new FileBlob("say \"hi\".txt", new byte[0], "text/plain"));

        String raw = new String(body.toByteArray(), StandardCharsets.UTF_8);
        assertThat(raw).contains("filename=\"say %22hi%22.txt\"");
        assertThat(raw).endsWith("--b--\r\n");
    }
}
