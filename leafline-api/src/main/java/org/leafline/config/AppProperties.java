package org.leafline.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {
    private Storage storage = new Storage();
    private Auth auth = new Auth();
    private Library library = new Library();
    private Reader reader = new Reader();

    @Getter
    @Setter
    public static class Storage {
        /**
         * Directory the local blob store writes under. Uploaded books, covers and re-hosted
         * chapter assets all live here.
         */
        private String root = "./data/blobs";
        private String publicBaseUrl = "/api/v1/blobs";
    }

    @Getter
    @Setter
    public static class Auth {
        private String userHeader = "X-User-Id";
        private boolean createNewUsers = true;
    }

    @Getter
    @Setter
    public static class Library {
        private boolean parseOnUpload = true;
    }

    @Getter
    @Setter
    public static class Reader {
        private int defaultWindowSize = 10;
        private int maxWindowSize = 20;
    }
}
