/************************************************************************
 Copyright 2018 eBay Inc.
 Author/Developer: Brendan McCarthy

 Licensed under the Apache License, Version 2.0 (the "License");
 you may not use this file except in compliance with the License.
 You may obtain a copy of the License at

 https://www.apache.org/licenses/LICENSE-2.0

 Unless required by applicable law or agreed to in writing, software
 distributed under the License is distributed on an "AS IS" BASIS,
 WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 See the License for the specific language governing permissions and
 limitations under the License.
 **************************************************************************/
package com.ebay.bascomflow.obs;

import com.ebay.bascomflow.core.Collaborator;
import com.ebay.bascomflow.core.CommandTemplate;
import com.ebay.bascomflow.core.ProcessCollaborator;

import java.util.Map;

/**
 * Creates the collaborator that performs one stage's work for one task.
 *
 * @author Brendan McCarthy
 */
@FunctionalInterface
public interface CollaboratorFactory {

    /**
     * @param stage  name
     * @param values placeholder values of the task: always {@code obsid}, {@code dir} and {@code variants},
     *               and where applicable {@code variant}, {@code input} and {@code solution}
     * @return collaborator
     */
    Collaborator create(String stage, Map<String, String> values);

    /**
     * Runs the external command configured for each stage as {@code command.<stage>}.
     *
     * @param config holding the templates
     * @return factory
     */
    static CollaboratorFactory fromTemplates(ObsPipelineConfig config) {
        return (stage, values) -> new ProcessCollaborator(CommandTemplate.parse(config.getCommand(stage)).expand(values));
    }
}
