package com.solis.model;

import lombok.Builder;
import lombok.Value;

/**
 * Source-code activity of one repository ({@code owner/name}).
 * Delta fields stay {@code null} until a previous report provides a baseline.
 * {@code commitsDelta} is different: the source reports it as recent minus prior window commits.
 */
@Value
@Builder(toBuilder = true)
public class RepoSignal {
    String repo;
    long stars;
    long forks;
    long contributors;
    long commits;
    String language;
    long commitsDelta;
    Long starsDelta;
    Long forksDelta;
    Long contributorsDelta;
    double commitsZScore;
    double starsZScore;
    double forksZScore;
}
