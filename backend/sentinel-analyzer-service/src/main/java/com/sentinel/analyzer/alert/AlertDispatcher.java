package com.sentinel.analyzer.alert;

import com.sentinel.analyzer.model.AlertRule;
import com.sentinel.analyzer.model.Finding;

public interface AlertDispatcher {

  void dispatch(AlertRule rule, Finding finding);
}
