package com.triagebot.source;

import com.triagebot.core.error.SourceUnavailableException;
import com.triagebot.core.model.Issue;

import java.util.List;
import java.util.Set;

/**
 * The issue tracker the pipeline reads issues from and reports decisions back to.
 * <p>
 * No implementation ships with the pipeline; an application registers one as a bean.
 * Every method reports tracker failures as {@link SourceUnavailableException}.
 */
public interface IssueSource {

    Issue fetchIssue(int issueNumber);

    List<Issue> listOpenIssues();

    void applyLabels(int issueNumber, Set<String> labels);

    void postComment(int issueNumber, String text);
}
