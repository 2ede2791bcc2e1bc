package com.cinelink.federation.graph;

import java.util.List;

public record MovieReviewers(String title, List<Reviewer> reviewers) {
}
