package acmeca.controllers;

import acmeca.messages.DirectoryResponse;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class DirectoryController {

    public static final String DIRECTORY_PATH = "/directory";

    private final AcmeResponses acmeResponses;

    public DirectoryController(AcmeResponses acmeResponses) {
        this.acmeResponses = acmeResponses;
    }

    @GetMapping(value = DIRECTORY_PATH, produces = MediaType.APPLICATION_JSON_VALUE)
    public DirectoryResponse directory() {
        return acmeResponses.directory();
    }
}
