package com.repolink.dispatch.api;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /: Human-readable endpoint index.
 */
@RestController
public class IndexController {

    private static final String INDEX = """
            <h2>Repolink</h2>
            <p>Context cache and atomic GitHub commits.</p>
            <h3>Context endpoints</h3>
            <ul>
              <li>POST /v1/init - Initialize a new context</li>
              <li>POST /v1/add_file - Add a file to the context</li>
              <li>POST /v1/remove_file - Remove a file from the context</li>
              <li>GET /v1/get_context - Get the current context</li>
              <li>POST /v1/search - Search in the context</li>
            </ul>
            <h3>Repository endpoints</h3>
            <ul>
              <li>POST /v1/push_files - Commit several files atomically</li>
              <li>PUT /commit - Commit or update a single file</li>
              <li>POST /v1/github_files - Fetch files under a path</li>
              <li>GET /repos - List repositories</li>
              <li>POST /repo - Create a repository</li>
              <li>GET /branch, POST /branch, DELETE /branch - Branch info, create, delete</li>
              <li>GET /commits - List commits</li>
              <li>GET /files - List files in a path</li>
              <li>GET /readme - Read the README</li>
              <li>POST /pullrequest - Open a pull request</li>
              <li>GET /health - Health check</li>
            </ul>
            """;

    @GetMapping(value = "/", produces = MediaType.TEXT_HTML_VALUE)
    public String index() {
        return INDEX;
    }
}
